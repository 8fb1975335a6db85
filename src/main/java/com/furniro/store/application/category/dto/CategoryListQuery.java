package com.furniro.store.application.category.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 카테고리 목록 조회 조건
 * sortBy: name | createdAt (기본 createdAt), sortOrder: asc | desc (기본 desc)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryListQuery {
    private String searchQuery;
    private Integer page;
    private Integer limit;
    private String sortBy;
    private String sortOrder;
}
