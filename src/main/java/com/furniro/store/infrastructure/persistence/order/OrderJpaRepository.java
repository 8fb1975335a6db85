package com.furniro.store.infrastructure.persistence.order;

import com.furniro.store.domain.order.Order;
import com.furniro.store.domain.order.OrderStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 * Spring Data JPA를 통한 Order 엔티티 영구 저장소
 *
 * FetchType 정책:
 * - Order.orderItems: LAZY
 * - 단건 조회는 fetch join, 목록 조회는 페이지네이션을 위해 fetch join 없이 batch fetch 사용
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    /**
     * 주문 ID로 조회 (orderItems 함께 로드)
     */
    @Query("SELECT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithItems(@Param("orderId") Long orderId);

    /**
     * 사용자별 주문 조회 (정렬, 페이지네이션은 Pageable)
     */
    @Query("SELECT o FROM Order o WHERE o.userId = :userId")
    List<Order> findByUserId(@Param("userId") Long userId, Pageable pageable);

    long countByUserId(Long userId);

    /**
     * 관리자 조건 검색
     *
     * 모든 조건은 항상 값을 가지며, 조건 미지정은 전체를 포함하는 값으로 치환되어 전달됩니다.
     * (allUsers = true, pattern = '%', 전체 상태 목록, 넓은 날짜/금액 범위)
     */
    @Query("SELECT o FROM Order o " +
           "WHERE (:allUsers = true OR o.userId = :userId) " +
           "AND LOWER(o.orderNumber) LIKE :pattern " +
           "AND o.status IN :statuses " +
           "AND o.createdAt >= :createdFrom AND o.createdAt < :createdTo " +
           "AND o.totalAmount >= :minAmount AND o.totalAmount <= :maxAmount")
    List<Order> search(@Param("allUsers") boolean allUsers,
                       @Param("userId") Long userId,
                       @Param("pattern") String pattern,
                       @Param("statuses") Collection<OrderStatus> statuses,
                       @Param("createdFrom") LocalDateTime createdFrom,
                       @Param("createdTo") LocalDateTime createdTo,
                       @Param("minAmount") BigDecimal minAmount,
                       @Param("maxAmount") BigDecimal maxAmount,
                       Pageable pageable);

    @Query("SELECT COUNT(o) FROM Order o " +
           "WHERE (:allUsers = true OR o.userId = :userId) " +
           "AND LOWER(o.orderNumber) LIKE :pattern " +
           "AND o.status IN :statuses " +
           "AND o.createdAt >= :createdFrom AND o.createdAt < :createdTo " +
           "AND o.totalAmount >= :minAmount AND o.totalAmount <= :maxAmount")
    long countSearch(@Param("allUsers") boolean allUsers,
                     @Param("userId") Long userId,
                     @Param("pattern") String pattern,
                     @Param("statuses") Collection<OrderStatus> statuses,
                     @Param("createdFrom") LocalDateTime createdFrom,
                     @Param("createdTo") LocalDateTime createdTo,
                     @Param("minAmount") BigDecimal minAmount,
                     @Param("maxAmount") BigDecimal maxAmount);
}
