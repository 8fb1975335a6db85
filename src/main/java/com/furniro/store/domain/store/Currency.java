package com.furniro.store.domain.store;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 통화 (code 기준 upsert, 소프트 삭제)
 */
@Entity
@Table(name = "currencies", uniqueConstraints = {
    @UniqueConstraint(columnNames = "code")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Currency {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "currency_id")
    private Long currencyId;

    @Column(name = "code", nullable = false, length = 10)
    private String code;

    @Column(name = "symbol", length = 10)
    private String symbol;

    @Column(name = "name")
    private String name;

    @Column(name = "exchange_rate", nullable = false, precision = 18, scale = 6)
    private BigDecimal exchangeRate;

    @Column(name = "is_default", nullable = false)
    private boolean isDefault;

    @Column(name = "is_active", nullable = false)
    private boolean isActive;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public static Currency createCurrency(String code, String symbol, String name, BigDecimal exchangeRate,
                                          boolean isDefault, boolean isActive) {
        return Currency.builder()
                .code(code)
                .symbol(symbol)
                .name(name)
                .exchangeRate(exchangeRate == null ? BigDecimal.ONE : exchangeRate)
                .isDefault(isDefault)
                .isActive(isActive)
                .build();
    }

    /**
     * 요청 값으로 갱신하고 삭제 상태를 해제
     */
    public void update(String symbol, String name, BigDecimal exchangeRate, boolean isDefault, boolean isActive) {
        this.symbol = symbol;
        this.name = name;
        if (exchangeRate != null) {
            this.exchangeRate = exchangeRate;
        }
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
