package com.furniro.store.application.product.dto;

import com.furniro.store.domain.category.Category;
import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.ProductPricing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 상품 상세 정보 (Application layer 내부 DTO)
 */
@Getter
@Builder
@AllArgsConstructor
public class ProductDetailResult {
    private Long productId;
    private String name;
    private String subtitle;
    private String description;
    private String brand;
    private String additionalInformation;
    private BigDecimal price;
    private Integer sale;
    private BigDecimal effectivePrice;
    private List<ProductColorResult> colors;
    private List<Long> categoryIds;
    private List<String> categoryNames;
    private LocalDateTime createdAt;

    /**
     * @param categories 상품이 참조하는 카테고리 (삭제된 카테고리는 호출자가 제외)
     */
    public static ProductDetailResult from(Product product, List<Category> categories) {
        return ProductDetailResult.builder()
                .productId(product.getProductId())
                .name(product.getName())
                .subtitle(product.getSubtitle())
                .description(product.getDescription())
                .brand(product.getBrand())
                .additionalInformation(product.getAdditionalInformation())
                .price(product.getPrice())
                .sale(product.getSale())
                .effectivePrice(ProductPricing.round(product.getEffectivePrice()))
                .colors(product.getColors().stream()
                        .map(ProductColorResult::from)
                        .collect(Collectors.toList()))
                .categoryIds(categories.stream().map(Category::getCategoryId).collect(Collectors.toList()))
                .categoryNames(categories.stream().map(Category::getName).collect(Collectors.toList()))
                .createdAt(product.getCreatedAt())
                .build();
    }
}
