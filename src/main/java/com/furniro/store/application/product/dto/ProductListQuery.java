package com.furniro.store.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 상품 목록 조회 조건 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductListQuery {
    private Integer page;
    private Integer limit;
    private List<Long> categoryIds;
    private String sortBy;
    private String order;
    private BigDecimal minPrice;
    private BigDecimal maxPrice;
}
