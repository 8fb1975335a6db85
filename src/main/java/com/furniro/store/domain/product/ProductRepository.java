package com.furniro.store.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface ProductRepository {

    /**
     * 삭제되지 않은 전체 상품 조회 (색상 포함)
     */
    List<Product> findAllActive();

    /**
     * 상품 ID로 조회 (삭제 여부 무관, 색상 포함)
     */
    Optional<Product> findById(Long productId);

    /**
     * 여러 상품 일괄 조회
     */
    List<Product> findAllByIds(Collection<Long> productIds);

    /**
     * 특정 카테고리를 참조하는 상품 조회 (삭제 여부 무관)
     */
    List<Product> findByCategoryId(Long categoryId);

    /**
     * 특정 카테고리를 참조하는 삭제되지 않은 상품 수
     */
    long countActiveByCategoryId(Long categoryId);

    Product save(Product product);

    /**
     * 색상 재고 조건부 차감
     *
     * quantity >= 요청 수량인 경우에만 원자적으로 차감합니다.
     *
     * @return 변경된 행 수 (0이면 재고 부족)
     */
    int decreaseColorStock(Long colorId, int quantity);
}
