package com.furniro.store.domain.category;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Category Repository Interface (Domain Layer - Port)
 */
public interface CategoryRepository {

    List<Category> findAll();

    Optional<Category> findById(Long categoryId);

    Optional<Category> findByName(String name);

    List<Category> findAllByIds(Collection<Long> categoryIds);

    Category save(Category category);

    void delete(Category category);
}
