package com.furniro.store.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * CartItem 도메인 엔티티
 * 장바구니 라인 항목: (상품, 색상, 수량)
 * subtotal은 CartPriceCalculator가 실 판매가 × 수량으로 계산하여 저장 (소수점 2자리)
 */
@Entity
@Table(name = "cart_items")
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CartItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_item_id")
    private Long cartItemId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "color_name", nullable = false)
    private String colorName;

    @Column(name = "color_hex", nullable = false, length = 16)
    private String colorHex;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "subtotal", nullable = false, precision = 14, scale = 2)
    private BigDecimal subtotal;

    public static CartItem createItem(Long productId, String colorName, String colorHex, int quantity) {
        if (quantity < CartConstants.MIN_ADD_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        return CartItem.builder()
                .productId(productId)
                .colorName(colorName)
                .colorHex(colorHex)
                .quantity(quantity)
                .subtotal(BigDecimal.ZERO)
                .build();
    }

    /**
     * 수량 누적 (재고 상한 적용)
     *
     * @param amount 추가 수량
     * @param cap 가용 재고
     */
    public void increaseQuantity(int amount, int cap) {
        this.quantity = (int) Math.min((long) this.quantity + amount, cap);
    }

    /**
     * 수량 교체 (재고 상한 미적용)
     */
    public void changeQuantity(int quantity) {
        if (quantity < CartConstants.MIN_ADD_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        this.quantity = quantity;
    }

    public boolean matches(Long productId, String colorHex) {
        return this.productId.equals(productId) && this.colorHex.equalsIgnoreCase(colorHex);
    }

    void applySubtotal(BigDecimal subtotal) {
        this.subtotal = subtotal;
    }
}
