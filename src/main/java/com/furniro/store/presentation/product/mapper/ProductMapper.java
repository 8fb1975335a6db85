package com.furniro.store.presentation.product.mapper;

import com.furniro.store.application.product.dto.ProductColorCommand;
import com.furniro.store.application.product.dto.ProductColorResult;
import com.furniro.store.application.product.dto.ProductCommand;
import com.furniro.store.application.product.dto.ProductDetailResult;
import com.furniro.store.application.product.dto.ProductListQuery;
import com.furniro.store.application.product.dto.ProductListResult;
import com.furniro.store.application.product.dto.ProductSummaryResult;
import com.furniro.store.common.exception.ApplicationException;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.presentation.product.request.ProductColorRequest;
import com.furniro.store.presentation.product.request.ProductRequest;
import com.furniro.store.presentation.product.response.ProductColorResponse;
import com.furniro.store.presentation.product.response.ProductDetailResponse;
import com.furniro.store.presentation.product.response.ProductListResponse;
import com.furniro.store.presentation.product.response.ProductSummaryResponse;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class ProductMapper {

    /**
     * 목록 조회 파라미터 → 쿼리
     *
     * categories는 "1,3,5" 형태의 쉼표 구분 ID 목록입니다.
     *
     * @throws ApplicationException 숫자가 아닌 카테고리 ID
     */
    public ProductListQuery toProductListQuery(Integer page, Integer limit, String categories,
                                               String sortBy, String order,
                                               BigDecimal minPrice, BigDecimal maxPrice) {
        return ProductListQuery.builder()
                .page(page)
                .limit(limit)
                .categoryIds(parseCategoryIds(categories))
                .sortBy(sortBy)
                .order(order)
                .minPrice(minPrice)
                .maxPrice(maxPrice)
                .build();
    }

    public ProductCommand toProductCommand(ProductRequest request) {
        return ProductCommand.builder()
                .name(request.getName())
                .subtitle(request.getSubtitle())
                .description(request.getDescription())
                .brand(request.getBrand())
                .additionalInformation(request.getAdditionalInformation())
                .price(request.getPrice())
                .sale(request.getSale() != null ? request.getSale() : 0)
                .colors(request.getColors().stream()
                        .map(this::toProductColorCommand)
                        .collect(Collectors.toList()))
                .categoryIds(request.getCategoryIds() != null ? request.getCategoryIds() : List.of())
                .build();
    }

    public ProductListResponse toProductListResponse(ProductListResult result) {
        return ProductListResponse.builder()
                .totalProducts(result.getTotalProducts())
                .products(toProductSummaryResponses(result.getProducts()))
                .build();
    }

    public List<ProductSummaryResponse> toProductSummaryResponses(List<ProductSummaryResult> results) {
        return results.stream()
                .map(this::toProductSummaryResponse)
                .collect(Collectors.toList());
    }

    public ProductDetailResponse toProductDetailResponse(ProductDetailResult result) {
        return ProductDetailResponse.builder()
                .productId(result.getProductId())
                .name(result.getName())
                .subtitle(result.getSubtitle())
                .description(result.getDescription())
                .brand(result.getBrand())
                .additionalInformation(result.getAdditionalInformation())
                .price(result.getPrice())
                .sale(result.getSale())
                .effectivePrice(result.getEffectivePrice())
                .colors(result.getColors().stream()
                        .map(this::toProductColorResponse)
                        .collect(Collectors.toList()))
                .categoryIds(result.getCategoryIds())
                .categories(result.getCategoryNames())
                .createdAt(result.getCreatedAt())
                .build();
    }

    private ProductSummaryResponse toProductSummaryResponse(ProductSummaryResult result) {
        return ProductSummaryResponse.builder()
                .productId(result.getProductId())
                .name(result.getName())
                .subtitle(result.getSubtitle())
                .image(result.getImage())
                .price(result.getPrice())
                .sale(result.getSale())
                .effectivePrice(result.getEffectivePrice())
                .quantity(result.getQuantity())
                .mainColorHex(result.getMainColorHex())
                .categoryIds(result.getCategoryIds())
                .createdAt(result.getCreatedAt())
                .build();
    }

    private ProductColorCommand toProductColorCommand(ProductColorRequest request) {
        return ProductColorCommand.builder()
                .name(request.getName())
                .hex(request.getHex())
                .quantity(request.getQuantity())
                .imageUrls(request.getImageUrls())
                .build();
    }

    private ProductColorResponse toProductColorResponse(ProductColorResult result) {
        return ProductColorResponse.builder()
                .colorId(result.getColorId())
                .name(result.getName())
                .hex(result.getHex())
                .quantity(result.getQuantity())
                .imageUrls(result.getImageUrls())
                .build();
    }

    private List<Long> parseCategoryIds(String categories) {
        if (categories == null || categories.isBlank()) {
            return List.of();
        }
        try {
            return Arrays.stream(categories.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Long::valueOf)
                    .collect(Collectors.toList());
        } catch (NumberFormatException e) {
            throw new ApplicationException(ErrorCode.INVALID_REQUEST, "categories: " + categories, e);
        }
    }
}
