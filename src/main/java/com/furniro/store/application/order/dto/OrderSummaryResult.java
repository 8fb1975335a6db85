package com.furniro.store.application.order.dto;

import com.furniro.store.domain.order.Order;
import com.furniro.store.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 목록 항목 (Application layer 내부 DTO)
 */
@Getter
@Builder
@AllArgsConstructor
public class OrderSummaryResult {
    private Long orderId;
    private String orderNumber;
    private Long userId;
    private OrderStatus status;
    private BigDecimal totalAmount;
    private Integer itemCount;
    private LocalDateTime createdAt;

    public static OrderSummaryResult from(Order order) {
        return OrderSummaryResult.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .userId(order.getUserId())
                .status(order.getStatus())
                .totalAmount(order.getTotalAmount())
                .itemCount(order.getOrderItemCount())
                .createdAt(order.getCreatedAt())
                .build();
    }
}
