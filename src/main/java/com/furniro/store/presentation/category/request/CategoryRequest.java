package com.furniro.store.presentation.category.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 카테고리 등록/수정 요청 DTO
 * 이름 필수 여부는 등록 시 도메인에서 검증합니다 (수정은 부분 변경).
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryRequest {
    private String name;
    private String image;
    private String description;
}
