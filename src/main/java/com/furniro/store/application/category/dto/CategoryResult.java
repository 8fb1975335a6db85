package com.furniro.store.application.category.dto;

import com.furniro.store.domain.category.Category;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
@AllArgsConstructor
public class CategoryResult {
    private Long categoryId;
    private String name;
    private String image;
    private String description;
    private long productCount;
    private LocalDateTime createdAt;

    public static CategoryResult from(Category category, long productCount) {
        return CategoryResult.builder()
                .categoryId(category.getCategoryId())
                .name(category.getName())
                .image(category.getImage())
                .description(category.getDescription())
                .productCount(productCount)
                .createdAt(category.getCreatedAt())
                .build();
    }
}
