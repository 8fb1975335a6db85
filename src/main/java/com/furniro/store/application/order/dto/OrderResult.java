package com.furniro.store.application.order.dto;

import com.furniro.store.domain.order.Order;
import com.furniro.store.domain.order.OrderStatus;
import com.furniro.store.domain.order.ShippingAddress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 상세 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@AllArgsConstructor
public class OrderResult {
    private Long orderId;
    private String orderNumber;
    private Long userId;
    private OrderStatus status;
    private ShippingAddress shippingAddress;
    private String paymentMethod;
    private String transactionId;
    private BigDecimal totalAmount;
    private List<OrderItemResult> items;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static OrderResult from(Order order) {
        return OrderResult.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .userId(order.getUserId())
                .status(order.getStatus())
                .shippingAddress(order.getShippingAddress())
                .paymentMethod(order.getPaymentMethod())
                .transactionId(order.getTransactionId())
                .totalAmount(order.getTotalAmount())
                .items(order.getOrderItems().stream()
                        .map(OrderItemResult::from)
                        .collect(Collectors.toList()))
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
