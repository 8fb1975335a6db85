package com.furniro.store.presentation.category;

import com.furniro.store.application.category.CategoryService;
import com.furniro.store.presentation.category.mapper.CategoryMapper;
import com.furniro.store.presentation.category.request.CategoryRequest;
import com.furniro.store.presentation.category.response.CategoryListResponse;
import com.furniro.store.presentation.category.response.CategoryResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * CategoryController - Presentation 계층
 * 카테고리 API 요청 처리
 */
@RestController
@RequestMapping("/categories")
public class CategoryController {

    private final CategoryService categoryService;
    private final CategoryMapper categoryMapper;

    public CategoryController(CategoryService categoryService, CategoryMapper categoryMapper) {
        this.categoryService = categoryService;
        this.categoryMapper = categoryMapper;
    }

    /**
     * GET /categories - 카테고리 목록 (상품 수 포함)
     */
    @GetMapping
    public ResponseEntity<CategoryListResponse> getCategories(
            @RequestParam(name = "search_query", required = false) String searchQuery,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @RequestParam(name = "sort_order", required = false) String sortOrder) {
        return ResponseEntity.ok(categoryMapper.toCategoryListResponse(categoryService.getCategories(
                categoryMapper.toCategoryListQuery(searchQuery, page, limit, sortBy, sortOrder))));
    }

    @GetMapping("/{categoryId}")
    public ResponseEntity<CategoryResponse> getCategory(@PathVariable Long categoryId) {
        return ResponseEntity.ok(categoryMapper.toCategoryResponse(categoryService.getCategory(categoryId)));
    }

    @PostMapping
    public ResponseEntity<CategoryResponse> createCategory(@RequestBody CategoryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(categoryMapper.toCategoryResponse(
                categoryService.createCategory(categoryMapper.toCategoryCommand(request))));
    }

    @PatchMapping("/{categoryId}")
    public ResponseEntity<CategoryResponse> updateCategory(
            @PathVariable Long categoryId,
            @RequestBody CategoryRequest request) {
        return ResponseEntity.ok(categoryMapper.toCategoryResponse(
                categoryService.updateCategory(categoryId, categoryMapper.toCategoryCommand(request))));
    }

    /**
     * DELETE /categories/{categoryId} - 카테고리 삭제 (상품의 카테고리 목록에서도 제거)
     */
    @DeleteMapping("/{categoryId}")
    public ResponseEntity<Void> deleteCategory(@PathVariable Long categoryId) {
        categoryService.deleteCategory(categoryId);
        return ResponseEntity.noContent().build();
    }
}
