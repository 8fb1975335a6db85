package com.furniro.store.domain.order;

import com.furniro.store.domain.product.ProductPricing;
import com.furniro.store.domain.product.VariantInfo;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * OrderItem 도메인 엔티티
 *
 * 주문 시점의 상품 정보 스냅샷입니다.
 * 상품(Product)을 참조하지 않고 값을 복사하므로, 이후 상품 가격/색상이 바뀌어도 주문 내역은 그대로 유지됩니다.
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_item_id")
    private Long orderItemId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "color_name", nullable = false)
    private String colorName;

    @Column(name = "color_hex", nullable = false, length = 16)
    private String colorHex;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "line_total", nullable = false, precision = 14, scale = 2)
    private BigDecimal lineTotal;

    /**
     * 현재 변형 정보로 주문 항목 스냅샷 생성
     *
     * - unitPrice: 실 판매가 (소수점 2자리)
     * - lineTotal: round(실 판매가 × 수량), 장바구니 항목 소계와 동일한 계산식
     */
    public static OrderItem snapshot(VariantInfo variant, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("주문 수량은 0보다 커야 합니다");
        }
        return OrderItem.builder()
                .productId(variant.getProductId())
                .productName(variant.getProductName())
                .colorName(variant.getColorName())
                .colorHex(variant.getColorHex())
                .quantity(quantity)
                .unitPrice(ProductPricing.round(variant.getUnitPrice()))
                .lineTotal(ProductPricing.round(ProductPricing.lineTotal(variant.getUnitPrice(), quantity)))
                .build();
    }
}
