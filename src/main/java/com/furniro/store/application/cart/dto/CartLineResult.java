package com.furniro.store.application.cart.dto;

import com.furniro.store.domain.cart.PricedCartLine;
import com.furniro.store.domain.product.ProductPricing;
import com.furniro.store.domain.product.VariantInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 장바구니 항목 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@AllArgsConstructor
public class CartLineResult {
    private Long productId;
    private String productName;
    private String colorName;
    private String colorHex;
    private String imageUrl;
    private BigDecimal unitPrice;
    private Integer quantity;
    private Integer availableQuantity;
    private BigDecimal subtotal;

    public static CartLineResult from(PricedCartLine line) {
        VariantInfo variant = line.getVariant();
        return CartLineResult.builder()
                .productId(variant.getProductId())
                .productName(variant.getProductName())
                .colorName(variant.getColorName())
                .colorHex(variant.getColorHex())
                .imageUrl(variant.getImageUrl())
                .unitPrice(ProductPricing.round(variant.getUnitPrice()))
                .quantity(line.getQuantity())
                .availableQuantity(variant.getAvailableQuantity())
                .subtotal(line.getSubtotal())
                .build();
    }
}
