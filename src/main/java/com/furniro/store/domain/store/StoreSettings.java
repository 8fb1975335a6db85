package com.furniro.store.domain.store;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 스토어 기본 설정 (단일 행)
 */
@Entity
@Table(name = "store_settings")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreSettings {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "settings_id")
    private Long settingsId;

    @Column(name = "store_name")
    private String storeName;

    @Column(name = "default_currency", nullable = false, length = 10)
    private String defaultCurrency;

    @Column(name = "default_language", nullable = false, length = 10)
    private String defaultLanguage;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 저장된 설정이 없을 때 사용하는 기본값 (저장하지 않음)
     */
    public static StoreSettings defaults(String defaultCurrency, String defaultLanguage) {
        return StoreSettings.builder()
                .defaultCurrency(defaultCurrency)
                .defaultLanguage(defaultLanguage)
                .updatedAt(LocalDateTime.now())
                .build();
    }

    /**
     * 부분 수정 (null 필드는 유지)
     */
    public void update(String storeName, String defaultCurrency, String defaultLanguage) {
        if (storeName != null) {
            this.storeName = storeName;
        }
        if (defaultCurrency != null) {
            this.defaultCurrency = defaultCurrency;
        }
        if (defaultLanguage != null) {
            this.defaultLanguage = defaultLanguage;
        }
        this.updatedAt = LocalDateTime.now();
    }
}
