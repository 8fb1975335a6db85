package com.furniro.store.infrastructure.persistence.product;

import com.furniro.store.domain.product.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Product JPA Repository
 * Spring Data JPA를 통한 Product 엔티티 영구 저장소
 *
 * FetchType 정책:
 * - Product.colors: LAZY, 조회 시 fetch join
 * - 이미지 URL, 카테고리 ID 컬렉션은 default_batch_fetch_size로 일괄 로드
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    @Query("SELECT DISTINCT p FROM Product p " +
           "LEFT JOIN FETCH p.colors " +
           "WHERE p.deleted = false")
    List<Product> findAllActiveWithColors();

    @Query("SELECT DISTINCT p FROM Product p " +
           "LEFT JOIN FETCH p.colors " +
           "WHERE p.productId = :productId")
    Optional<Product> findByIdWithColors(@Param("productId") Long productId);

    @Query("SELECT DISTINCT p FROM Product p " +
           "LEFT JOIN FETCH p.colors " +
           "WHERE p.productId IN :productIds")
    List<Product> findAllByIdsWithColors(@Param("productIds") Collection<Long> productIds);

    @Query("SELECT DISTINCT p FROM Product p " +
           "JOIN p.categoryIds c " +
           "WHERE c = :categoryId")
    List<Product> findByCategoryId(@Param("categoryId") Long categoryId);

    @Query("SELECT COUNT(DISTINCT p) FROM Product p " +
           "JOIN p.categoryIds c " +
           "WHERE c = :categoryId AND p.deleted = false")
    long countActiveByCategoryId(@Param("categoryId") Long categoryId);
}
