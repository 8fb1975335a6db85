package com.furniro.store.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class ProductListResult {
    private long totalProducts;
    private List<ProductSummaryResult> products;
}
