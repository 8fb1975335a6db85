package com.furniro.store.application.category;

import com.furniro.store.application.category.dto.CategoryCommand;
import com.furniro.store.application.category.dto.CategoryListQuery;
import com.furniro.store.application.category.dto.CategoryListResult;
import com.furniro.store.application.category.dto.CategoryResult;
import com.furniro.store.application.common.Pagination;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.domain.category.Category;
import com.furniro.store.domain.category.CategoryNotFoundException;
import com.furniro.store.domain.category.CategoryRepository;
import com.furniro.store.domain.category.DuplicateCategoryException;
import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.ProductRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CategoryService - 카테고리 관리 (Application 계층)
 */
@Slf4j
@Service
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;
    private final StoreProperties storeProperties;

    public CategoryService(CategoryRepository categoryRepository,
                           ProductRepository productRepository,
                           StoreProperties storeProperties) {
        this.categoryRepository = categoryRepository;
        this.productRepository = productRepository;
        this.storeProperties = storeProperties;
    }

    /**
     * 카테고리 목록 조회 (이름 검색, 정렬, 페이지네이션)
     *
     * @throws CategoryNotFoundException 조회 결과가 없는 경우
     */
    @Transactional(readOnly = true)
    public CategoryListResult getCategories(CategoryListQuery query) {
        Pagination pagination = Pagination.of(query.getPage(), query.getLimit(), storeProperties);
        String keyword = query.getSearchQuery() == null ? "" : query.getSearchQuery().trim().toLowerCase();

        List<Category> filtered = categoryRepository.findAll().stream()
                .filter(c -> keyword.isEmpty() || c.getName().toLowerCase().contains(keyword))
                .sorted(comparatorOf(query.getSortBy(), query.getSortOrder()))
                .collect(Collectors.toList());

        if (filtered.isEmpty()) {
            throw new CategoryNotFoundException("조회된 카테고리가 없습니다");
        }

        List<CategoryResult> page = pagination.slice(filtered).stream()
                .map(c -> CategoryResult.from(c, productRepository.countActiveByCategoryId(c.getCategoryId())))
                .collect(Collectors.toList());

        return new CategoryListResult(page, pagination.getPage(), pagination.totalPages(filtered.size()), filtered.size());
    }

    @Transactional(readOnly = true)
    public CategoryResult getCategory(Long categoryId) {
        Category category = findCategory(categoryId);
        return CategoryResult.from(category, productRepository.countActiveByCategoryId(categoryId));
    }

    @Transactional
    public CategoryResult createCategory(CategoryCommand command) {
        if (command.getName() != null) {
            categoryRepository.findByName(command.getName().trim()).ifPresent(existing -> {
                throw new DuplicateCategoryException(existing.getName());
            });
        }
        Category saved = categoryRepository.save(
                Category.createCategory(command.getName(), command.getImage(), command.getDescription()));
        return CategoryResult.from(saved, 0L);
    }

    /**
     * 카테고리 수정
     *
     * @throws DuplicateCategoryException 다른 카테고리가 사용 중인 이름으로 변경
     */
    @Transactional
    public CategoryResult updateCategory(Long categoryId, CategoryCommand command) {
        Category category = findCategory(categoryId);

        if (command.getName() != null) {
            categoryRepository.findByName(command.getName().trim())
                    .filter(other -> !other.getCategoryId().equals(categoryId))
                    .ifPresent(other -> {
                        throw new DuplicateCategoryException(other.getName());
                    });
        }

        category.update(command.getName(), command.getImage(), command.getDescription());
        Category saved = categoryRepository.save(category);
        return CategoryResult.from(saved, productRepository.countActiveByCategoryId(categoryId));
    }

    /**
     * 카테고리 삭제
     *
     * 카테고리를 참조하던 모든 상품(삭제된 상품 포함)에서 카테고리 ID를 제거합니다.
     */
    @Transactional
    public void deleteCategory(Long categoryId) {
        Category category = findCategory(categoryId);

        int affected = 0;
        for (Product product : productRepository.findByCategoryId(categoryId)) {
            if (product.removeCategory(categoryId)) {
                productRepository.save(product);
                affected++;
            }
        }
        categoryRepository.delete(category);

        log.info("카테고리 삭제: categoryId={}, name={}, 참조 해제 상품 수={}", categoryId, category.getName(), affected);
    }

    private Category findCategory(Long categoryId) {
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new CategoryNotFoundException(categoryId));
    }

    private Comparator<Category> comparatorOf(String sortBy, String sortOrder) {
        Comparator<Category> comparator = "name".equalsIgnoreCase(sortBy)
                ? Comparator.comparing(Category::getName, String.CASE_INSENSITIVE_ORDER)
                : Comparator.comparing(Category::getCreatedAt);
        comparator = comparator.thenComparing(Category::getCategoryId);
        return "asc".equalsIgnoreCase(sortOrder) ? comparator : comparator.reversed();
    }
}
