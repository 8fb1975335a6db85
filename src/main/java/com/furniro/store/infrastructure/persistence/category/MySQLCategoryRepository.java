package com.furniro.store.infrastructure.persistence.category;

import com.furniro.store.domain.category.Category;
import com.furniro.store.domain.category.CategoryRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Category Repository 구현
 */
@Repository
public class MySQLCategoryRepository implements CategoryRepository {

    private final CategoryJpaRepository categoryJpaRepository;

    public MySQLCategoryRepository(CategoryJpaRepository categoryJpaRepository) {
        this.categoryJpaRepository = categoryJpaRepository;
    }

    @Override
    public List<Category> findAll() {
        return categoryJpaRepository.findAll();
    }

    @Override
    public Optional<Category> findById(Long categoryId) {
        return categoryJpaRepository.findById(categoryId);
    }

    @Override
    public Optional<Category> findByName(String name) {
        return categoryJpaRepository.findByName(name);
    }

    @Override
    public List<Category> findAllByIds(Collection<Long> categoryIds) {
        if (categoryIds == null || categoryIds.isEmpty()) {
            return List.of();
        }
        return categoryJpaRepository.findAllById(categoryIds);
    }

    @Override
    public Category save(Category category) {
        return categoryJpaRepository.save(category);
    }

    @Override
    public void delete(Category category) {
        categoryJpaRepository.delete(category);
    }
}
