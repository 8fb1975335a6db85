package com.furniro.store.presentation.category.mapper;

import com.furniro.store.application.category.dto.CategoryCommand;
import com.furniro.store.application.category.dto.CategoryListQuery;
import com.furniro.store.application.category.dto.CategoryListResult;
import com.furniro.store.application.category.dto.CategoryResult;
import com.furniro.store.presentation.category.request.CategoryRequest;
import com.furniro.store.presentation.category.response.CategoryListResponse;
import com.furniro.store.presentation.category.response.CategoryResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
public class CategoryMapper {

    public CategoryListQuery toCategoryListQuery(String searchQuery, Integer page, Integer limit,
                                                 String sortBy, String sortOrder) {
        return CategoryListQuery.builder()
                .searchQuery(searchQuery)
                .page(page)
                .limit(limit)
                .sortBy(sortBy)
                .sortOrder(sortOrder)
                .build();
    }

    public CategoryCommand toCategoryCommand(CategoryRequest request) {
        return CategoryCommand.builder()
                .name(request.getName())
                .image(request.getImage())
                .description(request.getDescription())
                .build();
    }

    public CategoryResponse toCategoryResponse(CategoryResult result) {
        return CategoryResponse.builder()
                .categoryId(result.getCategoryId())
                .name(result.getName())
                .image(result.getImage())
                .description(result.getDescription())
                .productCount(result.getProductCount())
                .createdAt(result.getCreatedAt())
                .build();
    }

    public CategoryListResponse toCategoryListResponse(CategoryListResult result) {
        return CategoryListResponse.builder()
                .categories(result.getCategories().stream()
                        .map(this::toCategoryResponse)
                        .collect(Collectors.toList()))
                .currentPage(result.getCurrentPage())
                .totalPages(result.getTotalPages())
                .totalCategories(result.getTotalCategories())
                .build();
    }
}
