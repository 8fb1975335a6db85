package com.furniro.store.application.category;

import com.furniro.store.application.category.dto.CategoryCommand;
import com.furniro.store.application.category.dto.CategoryListQuery;
import com.furniro.store.application.category.dto.CategoryListResult;
import com.furniro.store.application.category.dto.CategoryResult;
import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.config.TestDataFactory;
import com.furniro.store.domain.category.Category;
import com.furniro.store.domain.category.CategoryNotFoundException;
import com.furniro.store.domain.category.CategoryRepository;
import com.furniro.store.domain.category.DuplicateCategoryException;
import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * CategoryServiceTest - Application 계층 단위 테스트
 *
 * 테스트 대상: CategoryService
 * - 목록 (검색, 정렬, 페이지네이션, 상품 수)
 * - 등록 / 수정 (이름 중복)
 * - 삭제 (상품의 카테고리 참조 해제)
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CategoryService 단위 테스트")
class CategoryServiceTest {

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private ProductRepository productRepository;

    private CategoryService categoryService;

    private Category dining;
    private Category bedroom;
    private Category living;

    @BeforeEach
    void setup() {
        categoryService = new CategoryService(categoryRepository, productRepository, new StoreProperties());
        dining = category(1L, "Dining", LocalDateTime.of(2025, 1, 1, 0, 0));
        bedroom = category(2L, "Bedroom", LocalDateTime.of(2025, 1, 2, 0, 0));
        living = category(3L, "Living", LocalDateTime.of(2025, 1, 3, 0, 0));
    }

    private Category category(Long id, String name, LocalDateTime createdAt) {
        return Category.builder().categoryId(id).name(name).createdAt(createdAt).updatedAt(createdAt).build();
    }

    @Test
    @DisplayName("목록 - 기본 정렬은 생성일 내림차순, 상품 수 포함")
    void testGetCategories() {
        // Given
        when(categoryRepository.findAll()).thenReturn(List.of(dining, bedroom, living));
        when(productRepository.countActiveByCategoryId(any())).thenReturn(2L);

        // When
        CategoryListResult result = categoryService.getCategories(CategoryListQuery.builder().build());

        // Then
        assertEquals(3, result.getTotalCategories());
        assertEquals(1, result.getTotalPages());
        assertEquals("Living", result.getCategories().get(0).getName());
        assertEquals(2L, result.getCategories().get(0).getProductCount());
    }

    @Test
    @DisplayName("목록 - 이름 검색과 이름 오름차순, 페이지네이션")
    void testGetCategories_SearchSortPaginate() {
        when(categoryRepository.findAll()).thenReturn(List.of(dining, bedroom, living));
        when(productRepository.countActiveByCategoryId(any())).thenReturn(0L);

        CategoryListResult result = categoryService.getCategories(CategoryListQuery.builder()
                .searchQuery("IN").sortBy("name").sortOrder("asc").page(2).limit(1).build());

        assertEquals(2, result.getTotalCategories());
        assertEquals(2, result.getTotalPages());
        assertEquals(2, result.getCurrentPage());
        assertEquals("Living", result.getCategories().get(0).getName());
    }

    @Test
    @DisplayName("목록 - 결과 없음은 404")
    void testGetCategories_Empty() {
        when(categoryRepository.findAll()).thenReturn(List.of(dining));

        assertThrows(CategoryNotFoundException.class, () -> categoryService.getCategories(
                CategoryListQuery.builder().searchQuery("garden").build()));
    }

    @Test
    @DisplayName("등록 - 성공")
    void testCreateCategory() {
        when(categoryRepository.findByName("Office")).thenReturn(Optional.empty());
        when(categoryRepository.save(any(Category.class))).thenAnswer(invocation -> invocation.getArgument(0));

        CategoryResult result = categoryService.createCategory(CategoryCommand.builder()
                .name(" Office ").image("office.png").build());

        assertEquals("Office", result.getName());
        assertEquals(0L, result.getProductCount());
    }

    @Test
    @DisplayName("등록 - 이름 중복 / 이름 누락")
    void testCreateCategory_Invalid() {
        when(categoryRepository.findByName("Dining")).thenReturn(Optional.of(dining));

        assertThrows(DuplicateCategoryException.class,
                () -> categoryService.createCategory(CategoryCommand.builder().name("Dining").build()));
        DomainException e = assertThrows(DomainException.class,
                () -> categoryService.createCategory(CategoryCommand.builder().build()));
        assertEquals(ErrorCode.CATEGORY_INVALID_NAME, e.getErrorCode());
        verify(categoryRepository, never()).save(any());
    }

    @Test
    @DisplayName("수정 - 다른 카테고리 이름으로 변경 불가, 자기 이름 유지는 허용")
    void testUpdateCategory() {
        when(categoryRepository.findById(1L)).thenReturn(Optional.of(dining));
        when(categoryRepository.findByName("Bedroom")).thenReturn(Optional.of(bedroom));
        when(categoryRepository.findByName("Dining")).thenReturn(Optional.of(dining));
        when(categoryRepository.save(any(Category.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertThrows(DuplicateCategoryException.class, () -> categoryService.updateCategory(1L,
                CategoryCommand.builder().name("Bedroom").build()));

        CategoryResult result = categoryService.updateCategory(1L,
                CategoryCommand.builder().name("Dining").description("Tables and chairs").build());
        assertEquals("Tables and chairs", result.getDescription());
    }

    @Test
    @DisplayName("삭제 - 상품의 카테고리 참조 해제 후 삭제")
    void testDeleteCategory() {
        // Given
        Product table = TestDataFactory.product(10L, "Table", "100", 0, TestDataFactory.color(101L, "Oak", "#C0A080", 1));
        table.getCategoryIds().add(1L);
        table.getCategoryIds().add(2L);
        when(categoryRepository.findById(1L)).thenReturn(Optional.of(dining));
        when(productRepository.findByCategoryId(1L)).thenReturn(List.of(table));

        // When
        categoryService.deleteCategory(1L);

        // Then
        assertFalse(table.belongsTo(1L));
        assertTrue(table.belongsTo(2L));
        verify(productRepository).save(table);
        verify(categoryRepository).delete(dining);
    }

    @Test
    @DisplayName("삭제 - 없는 카테고리")
    void testDeleteCategory_NotFound() {
        when(categoryRepository.findById(9L)).thenReturn(Optional.empty());

        assertThrows(CategoryNotFoundException.class, () -> categoryService.deleteCategory(9L));
        verify(categoryRepository, never()).delete(any());
    }
}
