package com.furniro.store.domain.store;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 언어 (code 기준 upsert, 소프트 삭제)
 */
@Entity
@Table(name = "languages", uniqueConstraints = {
    @UniqueConstraint(columnNames = "code")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Language {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "language_id")
    private Long languageId;

    @Column(name = "code", nullable = false, length = 10)
    private String code;

    @Column(name = "name")
    private String name;

    @Column(name = "is_default", nullable = false)
    private boolean isDefault;

    @Column(name = "is_active", nullable = false)
    private boolean isActive;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public static Language createLanguage(String code, String name, boolean isDefault, boolean isActive) {
        return Language.builder()
                .code(code)
                .name(name)
                .isDefault(isDefault)
                .isActive(isActive)
                .build();
    }

    public void update(String name, boolean isDefault, boolean isActive) {
        this.name = name;
        this.isDefault = isDefault;
        this.isActive = isActive;
        this.deletedAt = null;
    }

    public void softDelete(LocalDateTime now) {
        this.deletedAt = now;
        this.isActive = false;
    }

    public boolean isVisible() {
        return this.isActive && this.deletedAt == null;
    }
}
