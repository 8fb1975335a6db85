package com.furniro.store.domain.store;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 배송 방법 (id 기준 upsert, 소프트 삭제)
 */
@Entity
@Table(name = "shipping_methods")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingMethod {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "shipping_method_id")
    private Long shippingMethodId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "cost", nullable = false, precision = 12, scale = 2)
    private BigDecimal cost;

    @Column(name = "is_active", nullable = false)
    private boolean isActive;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public static ShippingMethod createShippingMethod(String name, BigDecimal cost, boolean isActive) {
        return ShippingMethod.builder()
                .name(name)
                .cost(cost == null ? BigDecimal.ZERO : cost)
                .isActive(isActive)
                .build();
    }

    public void update(String name, BigDecimal cost, boolean isActive) {
        if (name != null) {
            this.name = name;
        }
        if (cost != null) {
            this.cost = cost;
        }
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
