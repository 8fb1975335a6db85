package com.furniro.store.infrastructure.persistence.product;

import com.furniro.store.domain.product.ProductColor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;

/**
 * ProductColor JPA Repository
 */
public interface ProductColorJpaRepository extends JpaRepository<ProductColor, Long> {

    /**
     * 조건부 재고 차감 (단일 UPDATE 문)
     *
     * quantity >= 요청 수량인 행만 갱신하므로, 동시에 마지막 재고를 차감하려는 트랜잭션 중
     * 하나만 1을 반환하고 나머지는 0을 반환합니다.
     *
     * @return 변경된 행 수
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE ProductColor c " +
           "SET c.quantity = c.quantity - :quantity, c.updatedAt = :now " +
           "WHERE c.colorId = :colorId AND c.quantity >= :quantity")
    int decreaseQuantity(@Param("colorId") Long colorId,
                         @Param("quantity") int quantity,
                         @Param("now") LocalDateTime now);
}
