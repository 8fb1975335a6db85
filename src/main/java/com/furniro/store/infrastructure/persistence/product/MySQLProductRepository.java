package com.furniro.store.infrastructure.persistence.product;

import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.ProductRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(ProductRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;
    private final ProductColorJpaRepository productColorJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository,
                                  ProductColorJpaRepository productColorJpaRepository) {
        this.productJpaRepository = productJpaRepository;
        this.productColorJpaRepository = productColorJpaRepository;
    }

    @Override
    public List<Product> findAllActive() {
        return productJpaRepository.findAllActiveWithColors();
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findByIdWithColors(productId);
    }

    @Override
    public List<Product> findAllByIds(Collection<Long> productIds) {
        if (productIds == null || productIds.isEmpty()) {
            return List.of();
        }
        return productJpaRepository.findAllByIdsWithColors(productIds);
    }

    @Override
    public List<Product> findByCategoryId(Long categoryId) {
        return productJpaRepository.findByCategoryId(categoryId);
    }

    @Override
    public long countActiveByCategoryId(Long categoryId) {
        return productJpaRepository.countActiveByCategoryId(categoryId);
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }

    @Override
    public int decreaseColorStock(Long colorId, int quantity) {
        return productColorJpaRepository.decreaseQuantity(colorId, quantity, LocalDateTime.now());
    }
}
