package com.furniro.store.application.category.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class CategoryListResult {
    private List<CategoryResult> categories;
    private int currentPage;
    private int totalPages;
    private long totalCategories;
}
