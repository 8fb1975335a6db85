package com.furniro.store.domain.product;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * VariantInfo - 상품 색상 변형의 현재 상태 스냅샷
 *
 * unitPrice는 할인이 적용된 실 판매가이며 반올림하지 않은 값입니다.
 */
@Getter
@Builder
@AllArgsConstructor
public class VariantInfo {
    private final Long productId;
    private final String productName;
    private final Long colorId;
    private final String colorName;
    private final String colorHex;
    private final BigDecimal unitPrice;
    private final int availableQuantity;
    private final String imageUrl;

    public static VariantInfo of(Product product, ProductColor color) {
        return VariantInfo.builder()
                .productId(product.getProductId())
                .productName(product.getName())
                .colorId(color.getColorId())
                .colorName(color.getName())
                .colorHex(color.getHex())
                .unitPrice(product.getEffectivePrice())
                .availableQuantity(color.getQuantity())
                .imageUrl(color.getFirstImageUrl())
                .build();
    }

    public boolean isOutOfStock() {
        return this.availableQuantity <= 0;
    }
}
