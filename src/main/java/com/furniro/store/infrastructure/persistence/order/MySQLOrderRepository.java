package com.furniro.store.infrastructure.persistence.order;

import com.furniro.store.domain.order.Order;
import com.furniro.store.domain.order.OrderRepository;
import com.furniro.store.domain.order.OrderSearchCondition;
import com.furniro.store.domain.order.OrderSortField;
import com.furniro.store.domain.order.OrderStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(OrderRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
public class MySQLOrderRepository implements OrderRepository {

    private static final LocalDateTime MIN_DATE = LocalDateTime.of(1970, 1, 1, 0, 0);
    private static final LocalDateTime MAX_DATE = LocalDateTime.of(9999, 12, 31, 0, 0);
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999999.99");

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findByIdWithItems(orderId);
    }

    @Override
    public List<Order> findByUserId(Long userId, int page, int size) {
        // page는 1부터 시작, PageRequest는 0부터 시작
        Pageable pageable = PageRequest.of(page - 1, size,
                Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "orderId")));
        return orderJpaRepository.findByUserId(userId, pageable);
    }

    @Override
    public long countByUserId(Long userId) {
        return orderJpaRepository.countByUserId(userId);
    }

    @Override
    public List<Order> search(OrderSearchCondition condition) {
        OrderSortField sortField = condition.getSortField() == null ? OrderSortField.CREATED_AT : condition.getSortField();
        Sort.Direction direction = condition.isAscending() ? Sort.Direction.ASC : Sort.Direction.DESC;
        Pageable pageable = PageRequest.of(condition.getPage() - 1, condition.getSize(),
                Sort.by(direction, sortField.getProperty()).and(Sort.by(direction, "orderId")));

        return orderJpaRepository.search(
                condition.getUserId() == null,
                userIdOf(condition),
                patternOf(condition),
                statusesOf(condition),
                fromOf(condition),
                toOf(condition),
                minAmountOf(condition),
                maxAmountOf(condition),
                pageable);
    }

    @Override
    public long count(OrderSearchCondition condition) {
        return orderJpaRepository.countSearch(
                condition.getUserId() == null,
                userIdOf(condition),
                patternOf(condition),
                statusesOf(condition),
                fromOf(condition),
                toOf(condition),
                minAmountOf(condition),
                maxAmountOf(condition));
    }

    private Long userIdOf(OrderSearchCondition condition) {
        return condition.getUserId() == null ? -1L : condition.getUserId();
    }

    private String patternOf(OrderSearchCondition condition) {
        String keyword = condition.getOrderNumberKeyword();
        if (keyword == null || keyword.isBlank()) {
            return "%";
        }
        return "%" + keyword.trim().toLowerCase() + "%";
    }

    private List<OrderStatus> statusesOf(OrderSearchCondition condition) {
        List<OrderStatus> statuses = condition.getStatuses();
        return statuses == null || statuses.isEmpty() ? Arrays.asList(OrderStatus.values()) : statuses;
    }

    private LocalDateTime fromOf(OrderSearchCondition condition) {
        return condition.getCreatedFrom() == null ? MIN_DATE : condition.getCreatedFrom();
    }

    private LocalDateTime toOf(OrderSearchCondition condition) {
        return condition.getCreatedTo() == null ? MAX_DATE : condition.getCreatedTo();
    }

    private BigDecimal minAmountOf(OrderSearchCondition condition) {
        return condition.getMinAmount() == null ? BigDecimal.ZERO : condition.getMinAmount();
    }

    private BigDecimal maxAmountOf(OrderSearchCondition condition) {
        return condition.getMaxAmount() == null ? MAX_AMOUNT : condition.getMaxAmount();
    }
}
