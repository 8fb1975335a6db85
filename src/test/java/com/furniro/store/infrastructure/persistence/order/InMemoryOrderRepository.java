package com.furniro.store.infrastructure.persistence.order;

import com.furniro.store.domain.order.Order;
import com.furniro.store.domain.order.OrderItem;
import com.furniro.store.domain.order.OrderRepository;
import com.furniro.store.domain.order.OrderSearchCondition;
import com.furniro.store.domain.order.OrderSortField;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * InMemoryOrderRepository - 테스트용 Order 저장소 (인메모리)
 * ConcurrentHashMap을 사용하여 스레드 안전성 제공
 */
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentHashMap<Long, Order> orders = new ConcurrentHashMap<>();
    private final AtomicLong orderIdSequence = new AtomicLong(5000L);
    private final AtomicLong orderItemIdSequence = new AtomicLong(5000L);

    @Override
    public Order save(Order order) {
        if (order.getOrderId() == null) {
            ReflectionTestUtils.setField(order, "orderId", orderIdSequence.incrementAndGet());
            for (OrderItem item : order.getOrderItems()) {
                ReflectionTestUtils.setField(item, "orderItemId", orderItemIdSequence.incrementAndGet());
            }
        }
        orders.put(order.getOrderId(), order);
        return order;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public List<Order> findByUserId(Long userId, int page, int size) {
        return orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .sorted(Comparator.comparing(Order::getCreatedAt).thenComparing(Order::getOrderId).reversed())
                .skip((long) (page - 1) * size)
                .limit(size)
                .collect(Collectors.toList());
    }

    @Override
    public long countByUserId(Long userId) {
        return orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .count();
    }

    @Override
    public List<Order> search(OrderSearchCondition condition) {
        return orders.values().stream()
                .filter(matches(condition))
                .sorted(comparatorOf(condition))
                .skip((long) (condition.getPage() - 1) * condition.getSize())
                .limit(condition.getSize())
                .collect(Collectors.toList());
    }

    @Override
    public long count(OrderSearchCondition condition) {
        return orders.values().stream()
                .filter(matches(condition))
                .count();
    }

    public int size() {
        return orders.size();
    }

    private Predicate<Order> matches(OrderSearchCondition c) {
        return order -> (c.getUserId() == null || order.getUserId().equals(c.getUserId()))
                && (c.getOrderNumberKeyword() == null || c.getOrderNumberKeyword().isBlank()
                    || order.getOrderNumber().toLowerCase().contains(c.getOrderNumberKeyword().trim().toLowerCase()))
                && (c.getStatuses() == null || c.getStatuses().isEmpty() || c.getStatuses().contains(order.getStatus()))
                && (c.getCreatedFrom() == null || !order.getCreatedAt().isBefore(c.getCreatedFrom()))
                && (c.getCreatedTo() == null || order.getCreatedAt().isBefore(c.getCreatedTo()))
                && (c.getMinAmount() == null || order.getTotalAmount().compareTo(c.getMinAmount()) >= 0)
                && (c.getMaxAmount() == null || order.getTotalAmount().compareTo(c.getMaxAmount()) <= 0);
    }

    private Comparator<Order> comparatorOf(OrderSearchCondition condition) {
        OrderSortField field = condition.getSortField() == null ? OrderSortField.CREATED_AT : condition.getSortField();
        Comparator<Order> comparator = switch (field) {
            case CREATED_AT -> Comparator.comparing(Order::getCreatedAt);
            case TOTAL_AMOUNT -> Comparator.comparing(Order::getTotalAmount);
            case ORDER_NUMBER -> Comparator.comparing(Order::getOrderNumber);
        };
        comparator = comparator.thenComparing(Order::getOrderId);
        return condition.isAscending() ? comparator : comparator.reversed();
    }
}
