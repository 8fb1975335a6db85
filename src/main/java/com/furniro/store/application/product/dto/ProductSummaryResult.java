package com.furniro.store.application.product.dto;

import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.ProductColor;
import com.furniro.store.domain.product.ProductPricing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 상품 목록 항목 (Application layer 내부 DTO)
 * quantity와 mainColorHex는 첫 번째 색상 기준
 */
@Getter
@Builder
@AllArgsConstructor
public class ProductSummaryResult {
    private Long productId;
    private String name;
    private String subtitle;
    private String image;
    private BigDecimal price;
    private Integer sale;
    private BigDecimal effectivePrice;
    private Integer quantity;
    private String mainColorHex;
    private List<Long> categoryIds;
    private LocalDateTime createdAt;

    public static ProductSummaryResult from(Product product) {
        return ProductSummaryResult.builder()
                .productId(product.getProductId())
                .name(product.getName())
                .subtitle(product.getSubtitle())
                .image(product.getMainImageUrl())
                .price(product.getPrice())
                .sale(product.getSale())
                .effectivePrice(ProductPricing.round(product.getEffectivePrice()))
                .quantity(product.getFirstColor().map(ProductColor::getQuantity).orElse(0))
                .mainColorHex(product.getFirstColor().map(ProductColor::getHex).orElse(null))
                .categoryIds(new ArrayList<>(product.getCategoryIds()))
                .createdAt(product.getCreatedAt())
                .build();
    }
}
