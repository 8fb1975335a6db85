package com.furniro.store.application.order;

import com.furniro.store.application.common.Pagination;
import com.furniro.store.application.order.dto.AdminOrderSearchCommand;
import com.furniro.store.application.order.dto.OrderListResult;
import com.furniro.store.application.order.dto.OrderResult;
import com.furniro.store.application.order.dto.OrderSummaryResult;
import com.furniro.store.common.exception.ApplicationException;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.domain.order.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 조회 및 관리자 상태 변경 (Application 계층)
 *
 * 주문 생성은 CheckoutService가 담당합니다.
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final StoreProperties storeProperties;

    public OrderService(OrderRepository orderRepository, StoreProperties storeProperties) {
        this.orderRepository = orderRepository;
        this.storeProperties = storeProperties;
    }

    /**
     * 사용자 주문 목록 조회 (최신순)
     *
     * @throws OrderNotFoundException 주문이 하나도 없는 경우
     */
    @Transactional(readOnly = true)
    public OrderListResult getUserOrders(Long userId, Integer page, Integer limit) {
        Pagination pagination = Pagination.of(page, limit, storeProperties);

        long total = orderRepository.countByUserId(userId);
        if (total == 0) {
            throw new OrderNotFoundException("사용자 ID: " + userId + "의 주문이 없습니다");
        }

        List<OrderSummaryResult> orders = orderRepository
                .findByUserId(userId, pagination.getPage(), pagination.getLimit()).stream()
                .map(OrderSummaryResult::from)
                .collect(Collectors.toList());

        return new OrderListResult(orders, total, pagination.getPage(), pagination.totalPages(total));
    }

    /**
     * 주문 상세 조회
     *
     * @throws OrderNotFoundException 주문 없음
     * @throws UserMismatchException 다른 사용자의 주문
     */
    @Transactional(readOnly = true)
    public OrderResult getOrderDetail(Long userId, Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        if (!order.isOwnedBy(userId)) {
            throw new UserMismatchException(orderId, userId);
        }
        return OrderResult.from(order);
    }

    /**
     * 관리자 주문 검색
     *
     * 최소/최대 금액이 모두 0이 아닌 값으로 주어졌을 때 최소 금액이 최대 금액 이상이면 INVALID_AMOUNT_RANGE
     */
    @Transactional(readOnly = true)
    public OrderListResult searchOrders(AdminOrderSearchCommand command) {
        Pagination pagination = Pagination.of(command.getPage(), command.getLimit(), storeProperties);
        validateAmountRange(command.getMinAmount(), command.getMaxAmount());

        List<OrderStatus> statuses = command.getStatuses() == null ? List.of() : command.getStatuses().stream()
                .filter(s -> s != null && !s.isBlank())
                .map(OrderStatus::fromString)
                .collect(Collectors.toList());

        OrderSearchCondition condition = OrderSearchCondition.builder()
                .userId(command.getUserId())
                .orderNumberKeyword(command.getSearchQuery())
                .statuses(statuses)
                .createdFrom(command.getStartDate() == null ? null : command.getStartDate().atStartOfDay())
                .createdTo(command.getEndDate() == null ? null : command.getEndDate().plusDays(1).atStartOfDay())
                .minAmount(nonZeroOrNull(command.getMinAmount()))
                .maxAmount(nonZeroOrNull(command.getMaxAmount()))
                .sortField(OrderSortField.fromString(command.getSortBy()))
                .ascending("asc".equalsIgnoreCase(command.getSortOrder()))
                .page(pagination.getPage())
                .size(pagination.getLimit())
                .build();

        long total = orderRepository.count(condition);
        List<OrderSummaryResult> orders = orderRepository.search(condition).stream()
                .map(OrderSummaryResult::from)
                .collect(Collectors.toList());

        return new OrderListResult(orders, total, pagination.getPage(), pagination.totalPages(total));
    }

    /**
     * 주문 상태 변경 (관리자)
     *
     * 상태 간 전환 순서는 제한하지 않습니다.
     */
    @Transactional
    public OrderResult changeStatus(Long orderId, String status) {
        OrderStatus newStatus = OrderStatus.fromString(status);
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        OrderStatus previous = order.getStatus();
        order.changeStatus(newStatus);
        Order saved = orderRepository.save(order);

        log.info("주문 상태 변경: orderId={}, orderNumber={}, {} -> {}",
                orderId, saved.getOrderNumber(), previous, newStatus);
        return OrderResult.from(saved);
    }

    // 금액 0은 조건 미지정으로 취급
    private BigDecimal nonZeroOrNull(BigDecimal amount) {
        return amount == null || amount.signum() == 0 ? null : amount;
    }

    private void validateAmountRange(BigDecimal minAmount, BigDecimal maxAmount) {
        if (minAmount == null || maxAmount == null) {
            return;
        }
        if (minAmount.signum() != 0 && maxAmount.signum() != 0 && minAmount.compareTo(maxAmount) >= 0) {
            throw new ApplicationException(ErrorCode.INVALID_AMOUNT_RANGE,
                    String.format("min: %s, max: %s", minAmount, maxAmount));
        }
    }
}
