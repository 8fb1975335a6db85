package com.furniro.store.application.product;

import com.furniro.store.application.common.Pagination;
import com.furniro.store.application.product.dto.*;
import com.furniro.store.common.exception.ApplicationException;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.domain.category.Category;
import com.furniro.store.domain.category.CategoryNotFoundException;
import com.furniro.store.domain.category.CategoryRepository;
import com.furniro.store.domain.product.*;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * ProductService - 상품 조회/관리 비즈니스 로직 (Application 계층)
 *
 * 목록 조회는 삭제되지 않은 전체 상품을 메모리에서 필터링, 정렬, 페이지네이션합니다.
 * 가격 필터와 가격 정렬은 모두 실 판매가(할인 적용) 기준입니다.
 */
@Service
public class ProductService {

    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final StoreProperties storeProperties;

    public ProductService(ProductRepository productRepository,
                          CategoryRepository categoryRepository,
                          StoreProperties storeProperties) {
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
        this.storeProperties = storeProperties;
    }

    /**
     * 상품 목록 조회
     *
     * - categories: 하나라도 포함하면 대상
     * - min/max 가격 미지정 시 카탈로그 최저/최고가
     * - 정렬 기본값: 등록일 내림차순
     */
    @Transactional(readOnly = true)
    public ProductListResult getProducts(ProductListQuery query) {
        Pagination pagination = Pagination.of(query.getPage(), query.getLimit(), storeProperties);

        List<Product> products = productRepository.findAllActive();
        BigDecimal minPrice = query.getMinPrice() != null ? query.getMinPrice() : minEffectivePrice(products);
        BigDecimal maxPrice = query.getMaxPrice() != null ? query.getMaxPrice() : maxEffectivePrice(products);

        List<Product> filtered = products.stream()
                .filter(p -> matchesCategories(p, query.getCategoryIds()))
                .filter(p -> inPriceRange(p, minPrice, maxPrice))
                .sorted(comparatorOf(query.getSortBy(), query.getOrder()))
                .collect(Collectors.toList());

        List<ProductSummaryResult> page = pagination.slice(filtered).stream()
                .map(ProductSummaryResult::from)
                .collect(Collectors.toList());

        return new ProductListResult(filtered.size(), page);
    }

    /**
     * 상품 상세 조회
     */
    @Transactional(readOnly = true)
    public ProductDetailResult getProduct(Long productId) {
        Product product = findActiveProduct(productId);
        return ProductDetailResult.from(product, categoriesOf(product));
    }

    /**
     * 상품명 또는 카테고리명으로 검색 (대소문자 무시, 부분 일치)
     *
     * @throws ApplicationException 검색어 누락
     * @throws ProductNotFoundException 검색 결과 없음
     */
    @Transactional(readOnly = true)
    public List<ProductSummaryResult> search(String query) {
        if (query == null || query.isBlank()) {
            throw new ApplicationException(ErrorCode.INVALID_REQUEST, "검색어는 필수입니다");
        }
        String keyword = query.trim().toLowerCase();

        Set<Long> matchedCategoryIds = categoryRepository.findAll().stream()
                .filter(c -> c.getName().toLowerCase().contains(keyword))
                .map(Category::getCategoryId)
                .collect(Collectors.toSet());

        List<ProductSummaryResult> results = productRepository.findAllActive().stream()
                .filter(p -> p.getName().toLowerCase().contains(keyword)
                        || p.getCategoryIds().stream().anyMatch(matchedCategoryIds::contains))
                .map(ProductSummaryResult::from)
                .collect(Collectors.toList());

        if (results.isEmpty()) {
            throw new ProductNotFoundException("검색어: " + query);
        }
        return results;
    }

    @Transactional(readOnly = true)
    public BigDecimal getMinPrice() {
        return ProductPricing.round(minEffectivePrice(productRepository.findAllActive()));
    }

    @Transactional(readOnly = true)
    public BigDecimal getMaxPrice() {
        return ProductPricing.round(maxEffectivePrice(productRepository.findAllActive()));
    }

    /**
     * 상품 등록
     *
     * @throws CategoryNotFoundException 존재하지 않는 카테고리 참조
     */
    @Transactional
    public ProductDetailResult createProduct(ProductCommand command) {
        List<Category> categories = requireCategories(command.getCategoryIds());

        Product product = Product.createProduct(command.getName(), command.getSubtitle(), command.getPrice(),
                command.getSale(), toColors(command.getColors()), command.getCategoryIds());
        product.describe(command.getDescription(), command.getBrand(), command.getAdditionalInformation());

        Product saved = productRepository.save(product);
        return ProductDetailResult.from(saved, categories);
    }

    /**
     * 상품 수정 (색상과 카테고리는 전체 교체)
     */
    @Transactional
    public ProductDetailResult updateProduct(Long productId, ProductCommand command) {
        Product product = findActiveProduct(productId);
        List<Category> categories = requireCategories(command.getCategoryIds());

        product.update(command.getName(), command.getSubtitle(), command.getPrice(), command.getSale(),
                toColors(command.getColors()), command.getCategoryIds());
        product.describe(
                command.getDescription() != null ? command.getDescription() : product.getDescription(),
                command.getBrand() != null ? command.getBrand() : product.getBrand(),
                command.getAdditionalInformation() != null ? command.getAdditionalInformation() : product.getAdditionalInformation());

        Product saved = productRepository.save(product);
        return ProductDetailResult.from(saved, categories);
    }

    /**
     * 상품 삭제 (소프트 삭제)
     */
    @Transactional
    public void deleteProduct(Long productId) {
        Product product = findActiveProduct(productId);
        product.softDelete();
        productRepository.save(product);
    }

    private Product findActiveProduct(Long productId) {
        return productRepository.findById(productId)
                .filter(p -> !p.isDeleted())
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private List<Category> categoriesOf(Product product) {
        return categoryRepository.findAllByIds(product.getCategoryIds());
    }

    private List<Category> requireCategories(List<Long> categoryIds) {
        if (categoryIds == null || categoryIds.isEmpty()) {
            return List.of();
        }
        Set<Long> distinctIds = new LinkedHashSet<>(categoryIds);
        List<Category> categories = categoryRepository.findAllByIds(distinctIds);
        Set<Long> foundIds = categories.stream().map(Category::getCategoryId).collect(Collectors.toSet());
        for (Long categoryId : distinctIds) {
            if (!foundIds.contains(categoryId)) {
                throw new CategoryNotFoundException(categoryId);
            }
        }
        return categories;
    }

    private List<ProductColor> toColors(List<ProductColorCommand> commands) {
        if (commands == null) {
            return List.of();
        }
        return commands.stream()
                .map(c -> ProductColor.createColor(c.getName(), c.getHex(), c.getQuantity(), c.getImageUrls()))
                .collect(Collectors.toList());
    }

    private boolean matchesCategories(Product product, List<Long> categoryIds) {
        if (categoryIds == null || categoryIds.isEmpty()) {
            return true;
        }
        return categoryIds.stream().anyMatch(product::belongsTo);
    }

    private boolean inPriceRange(Product product, BigDecimal minPrice, BigDecimal maxPrice) {
        BigDecimal effective = ProductPricing.round(product.getEffectivePrice());
        return effective.compareTo(minPrice) >= 0 && effective.compareTo(maxPrice) <= 0;
    }

    private Comparator<Product> comparatorOf(String sortBy, String order) {
        Comparator<Product> comparator = switch (ProductSortType.fromString(sortBy)) {
            case NAME -> Comparator.comparing(Product::getName, String.CASE_INSENSITIVE_ORDER);
            case PRICE -> Comparator.comparing(Product::getEffectivePrice);
            case DATE -> Comparator.comparing(Product::getCreatedAt);
        };
        comparator = comparator.thenComparing(Product::getProductId);
        return "asc".equalsIgnoreCase(order) ? comparator : comparator.reversed();
    }

    private BigDecimal minEffectivePrice(List<Product> products) {
        return products.stream()
                .map(p -> ProductPricing.round(p.getEffectivePrice()))
                .min(Comparator.naturalOrder())
                .orElse(BigDecimal.ZERO);
    }

    private BigDecimal maxEffectivePrice(List<Product> products) {
        return products.stream()
                .map(p -> ProductPricing.round(p.getEffectivePrice()))
                .max(Comparator.naturalOrder())
                .orElse(BigDecimal.ZERO);
    }
}
