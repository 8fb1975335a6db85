package com.furniro.store.infrastructure.persistence.category;

import com.furniro.store.domain.category.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Category JPA Repository
 */
public interface CategoryJpaRepository extends JpaRepository<Category, Long> {
    Optional<Category> findByName(String name);
}
