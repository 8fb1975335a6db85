package com.furniro.store.application.product;

import com.furniro.store.application.product.dto.ProductColorCommand;
import com.furniro.store.application.product.dto.ProductCommand;
import com.furniro.store.application.product.dto.ProductDetailResult;
import com.furniro.store.application.product.dto.ProductListQuery;
import com.furniro.store.application.product.dto.ProductListResult;
import com.furniro.store.application.product.dto.ProductSummaryResult;
import com.furniro.store.common.exception.ApplicationException;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.config.TestDataFactory;
import com.furniro.store.domain.category.Category;
import com.furniro.store.domain.category.CategoryNotFoundException;
import com.furniro.store.domain.category.CategoryRepository;
import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.ProductNotFoundException;
import com.furniro.store.domain.product.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

/**
 * ProductServiceTest - Application 계층 단위 테스트
 * Mockito 방식 테스트
 *
 * 테스트 대상: ProductService
 * - 목록 조회 (카테고리/가격 필터, 정렬, 페이지네이션)
 * - 상세 / 검색 / 최저가, 최고가
 * - 등록 / 수정 / 삭제
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProductService 단위 테스트")
class ProductServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private CategoryRepository categoryRepository;

    private ProductService productService;

    private Product chair;
    private Product sofa;
    private Product lamp;

    @BeforeEach
    void setup() {
        productService = new ProductService(productRepository, categoryRepository, new StoreProperties());

        // 실 판매가: chair 90, sofa 400, lamp 30
        chair = product(1L, "Syltherine", "100", 10, LocalDateTime.of(2025, 1, 1, 0, 0), 1L);
        sofa = product(2L, "Asgaard", "500", 20, LocalDateTime.of(2025, 1, 3, 0, 0), 2L);
        lamp = product(3L, "Leviosa", "30", 0, LocalDateTime.of(2025, 1, 2, 0, 0), 1L, 3L);
    }

    private Product product(Long id, String name, String price, int sale, LocalDateTime createdAt, Long... categoryIds) {
        return Product.builder()
                .productId(id)
                .name(name)
                .price(new BigDecimal(price))
                .sale(sale)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .colors(new ArrayList<>(List.of(TestDataFactory.color(id * 10, "White", "#FFFFFF", 4))))
                .categoryIds(new LinkedHashSet<>(List.of(categoryIds)))
                .build();
    }

    private Category category(Long id, String name) {
        return Category.builder().categoryId(id).name(name).createdAt(LocalDateTime.now()).build();
    }

    private List<Long> idsOf(ProductListResult result) {
        return result.getProducts().stream().map(ProductSummaryResult::getProductId).collect(Collectors.toList());
    }

    // ========== 목록 조회 ==========

    @Test
    @DisplayName("목록 조회 - 기본 정렬은 등록일 내림차순")
    void testGetProducts_DefaultSort() {
        // Given
        when(productRepository.findAllActive()).thenReturn(List.of(chair, sofa, lamp));

        // When
        ProductListResult result = productService.getProducts(ProductListQuery.builder().build());

        // Then
        assertEquals(3, result.getTotalProducts());
        assertEquals(List.of(2L, 3L, 1L), idsOf(result));
    }

    @Test
    @DisplayName("목록 조회 - 가격 정렬은 실 판매가 기준")
    void testGetProducts_SortByEffectivePrice() {
        when(productRepository.findAllActive()).thenReturn(List.of(chair, sofa, lamp));

        ProductListResult result = productService.getProducts(ProductListQuery.builder()
                .sortBy("price").order("asc").build());

        assertEquals(List.of(3L, 1L, 2L), idsOf(result));
        assertEquals(new BigDecimal("90.00"), result.getProducts().get(1).getEffectivePrice());
    }

    @Test
    @DisplayName("목록 조회 - 카테고리 중 하나라도 포함, 가격 범위는 실 판매가")
    void testGetProducts_FilterByCategoryAndPrice() {
        when(productRepository.findAllActive()).thenReturn(List.of(chair, sofa, lamp));

        ProductListResult byCategory = productService.getProducts(ProductListQuery.builder()
                .categoryIds(List.of(3L, 2L)).sortBy("name").order("asc").build());
        ProductListResult byPrice = productService.getProducts(ProductListQuery.builder()
                .minPrice(new BigDecimal("50")).maxPrice(new BigDecimal("100")).build());

        assertEquals(List.of(2L, 3L), idsOf(byCategory));
        assertEquals(List.of(1L), idsOf(byPrice));
    }

    @Test
    @DisplayName("목록 조회 - 페이지네이션, 전체 개수는 필터 결과 기준")
    void testGetProducts_Pagination() {
        when(productRepository.findAllActive()).thenReturn(List.of(chair, sofa, lamp));

        ProductListResult result = productService.getProducts(ProductListQuery.builder()
                .page(2).limit(2).build());

        assertEquals(3, result.getTotalProducts());
        assertEquals(List.of(1L), idsOf(result));
    }

    @Test
    @DisplayName("목록 조회 - 잘못된 페이지 파라미터")
    void testGetProducts_InvalidPagination() {
        ApplicationException e = assertThrows(ApplicationException.class,
                () -> productService.getProducts(ProductListQuery.builder().limit(0).build()));

        assertEquals(ErrorCode.INVALID_PAGINATION, e.getErrorCode());
        verifyNoInteractions(productRepository);
    }

    // ========== 상세 / 검색 / 가격 ==========

    @Test
    @DisplayName("상세 조회 - 카테고리 이름 포함")
    void testGetProduct() {
        when(productRepository.findById(3L)).thenReturn(Optional.of(lamp));
        when(categoryRepository.findAllByIds(anyCollection()))
                .thenReturn(List.of(category(1L, "Chairs"), category(3L, "Lighting")));

        ProductDetailResult result = productService.getProduct(3L);

        assertEquals("Leviosa", result.getName());
        assertEquals(List.of("Chairs", "Lighting"), result.getCategoryNames());
        assertEquals(1, result.getColors().size());
    }

    @Test
    @DisplayName("상세 조회 - 삭제된 상품은 404")
    void testGetProduct_Deleted() {
        lamp.softDelete();
        when(productRepository.findById(3L)).thenReturn(Optional.of(lamp));

        assertThrows(ProductNotFoundException.class, () -> productService.getProduct(3L));
    }

    @Test
    @DisplayName("검색 - 상품명 또는 카테고리명 (대소문자 무시)")
    void testSearch() {
        when(categoryRepository.findAll()).thenReturn(List.of(category(2L, "Sofas")));
        when(productRepository.findAllActive()).thenReturn(List.of(chair, sofa, lamp));

        List<ProductSummaryResult> byName = productService.search("LEVI");
        List<ProductSummaryResult> byCategory = productService.search("sofa");

        assertEquals(1, byName.size());
        assertEquals(3L, byName.get(0).getProductId());
        assertEquals(1, byCategory.size());
        assertEquals(2L, byCategory.get(0).getProductId());
    }

    @Test
    @DisplayName("검색 - 빈 검색어는 400, 결과 없음은 404")
    void testSearch_Invalid() {
        assertThrows(ApplicationException.class, () -> productService.search(" "));

        when(categoryRepository.findAll()).thenReturn(List.of());
        when(productRepository.findAllActive()).thenReturn(List.of(chair));
        assertThrows(ProductNotFoundException.class, () -> productService.search("table"));
    }

    @Test
    @DisplayName("최저가/최고가 - 실 판매가 기준, 상품이 없으면 0")
    void testMinMaxPrice() {
        when(productRepository.findAllActive()).thenReturn(List.of(chair, sofa, lamp));

        assertEquals(new BigDecimal("30.00"), productService.getMinPrice());
        assertEquals(new BigDecimal("400.00"), productService.getMaxPrice());

        when(productRepository.findAllActive()).thenReturn(List.of());
        assertEquals(new BigDecimal("0.00"), productService.getMinPrice());
    }

    // ========== 등록 / 수정 / 삭제 ==========

    private ProductCommand command(List<Long> categoryIds) {
        return ProductCommand.builder()
                .name("Pingky")
                .subtitle("Cute bed set")
                .description("Solid wood")
                .brand("Furniro")
                .price(new BigDecimal("7000"))
                .sale(50)
                .colors(List.of(ProductColorCommand.builder()
                        .name("Pink").hex("#FFC0CB").quantity(5).imageUrls(List.of("https://cdn/p.jpg")).build()))
                .categoryIds(categoryIds)
                .build();
    }

    @Test
    @DisplayName("등록 - 성공")
    void testCreateProduct() {
        // Given
        when(categoryRepository.findAllByIds(anyCollection())).thenReturn(List.of(category(1L, "Beds")));
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        ProductDetailResult result = productService.createProduct(command(List.of(1L)));

        // Then
        ArgumentCaptor<Product> captor = ArgumentCaptor.forClass(Product.class);
        verify(productRepository).save(captor.capture());
        assertEquals("Furniro", captor.getValue().getBrand());
        assertEquals(new BigDecimal("3500.00"), result.getEffectivePrice());
        assertEquals(List.of("Beds"), result.getCategoryNames());
    }

    @Test
    @DisplayName("등록 - 존재하지 않는 카테고리 참조")
    void testCreateProduct_UnknownCategory() {
        when(categoryRepository.findAllByIds(anyCollection())).thenReturn(List.of(category(1L, "Beds")));

        assertThrows(CategoryNotFoundException.class, () -> productService.createProduct(command(List.of(1L, 9L))));
        verify(productRepository, never()).save(any());
    }

    @Test
    @DisplayName("수정 - 색상과 카테고리 전체 교체")
    void testUpdateProduct() {
        when(productRepository.findById(1L)).thenReturn(Optional.of(chair));
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ProductDetailResult result = productService.updateProduct(1L, command(List.of()));

        assertEquals("Pingky", result.getName());
        assertEquals(1, chair.getColors().size());
        assertEquals("#FFC0CB", chair.getColors().get(0).getHex());
        assertTrue(chair.getCategoryIds().isEmpty());
    }

    @Test
    @DisplayName("삭제 - 소프트 삭제, 없는 상품은 404")
    void testDeleteProduct() {
        when(productRepository.findById(1L)).thenReturn(Optional.of(chair));
        when(productRepository.findById(9L)).thenReturn(Optional.empty());

        productService.deleteProduct(1L);

        assertTrue(chair.isDeleted());
        verify(productRepository).save(chair);
        assertThrows(ProductNotFoundException.class, () -> productService.deleteProduct(9L));
    }
}
