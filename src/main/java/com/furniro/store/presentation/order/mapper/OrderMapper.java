package com.furniro.store.presentation.order.mapper;

import com.furniro.store.application.order.dto.AdminOrderSearchCommand;
import com.furniro.store.application.order.dto.OrderItemResult;
import com.furniro.store.application.order.dto.OrderListResult;
import com.furniro.store.application.order.dto.OrderResult;
import com.furniro.store.application.order.dto.OrderSummaryResult;
import com.furniro.store.application.order.dto.PlaceOrderCommand;
import com.furniro.store.domain.order.ShippingAddress;
import com.furniro.store.presentation.order.request.PlaceOrderRequest;
import com.furniro.store.presentation.order.request.ShippingAddressRequest;
import com.furniro.store.presentation.order.response.OrderDetailResponse;
import com.furniro.store.presentation.order.response.OrderItemResponse;
import com.furniro.store.presentation.order.response.OrderListResponse;
import com.furniro.store.presentation.order.response.OrderSummaryResponse;
import com.furniro.store.presentation.order.response.ShippingAddressResponse;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class OrderMapper {

    public PlaceOrderCommand toPlaceOrderCommand(PlaceOrderRequest request) {
        return PlaceOrderCommand.builder()
                .shippingAddress(toShippingAddress(request.getShippingAddress()))
                .paymentMethod(request.getPaymentMethod())
                .transactionId(request.getTransactionId())
                .build();
    }

    /**
     * 관리자 검색 파라미터 → 커맨드
     *
     * status는 "PENDING,SHIPPED" 형태의 쉼표 구분 문자열입니다.
     */
    public AdminOrderSearchCommand toAdminOrderSearchCommand(Long userId, String searchQuery, String status,
                                                             LocalDate startDate, LocalDate endDate,
                                                             BigDecimal minAmount, BigDecimal maxAmount,
                                                             String sortBy, String sortOrder,
                                                             Integer page, Integer limit) {
        return AdminOrderSearchCommand.builder()
                .userId(userId)
                .searchQuery(searchQuery)
                .statuses(splitStatuses(status))
                .startDate(startDate)
                .endDate(endDate)
                .minAmount(minAmount)
                .maxAmount(maxAmount)
                .sortBy(sortBy)
                .sortOrder(sortOrder)
                .page(page)
                .limit(limit)
                .build();
    }

    public OrderDetailResponse toOrderDetailResponse(OrderResult result) {
        return OrderDetailResponse.builder()
                .orderId(result.getOrderId())
                .orderNumber(result.getOrderNumber())
                .userId(result.getUserId())
                .status(result.getStatus().name())
                .shippingAddress(toShippingAddressResponse(result.getShippingAddress()))
                .paymentMethod(result.getPaymentMethod())
                .transactionId(result.getTransactionId())
                .totalAmount(result.getTotalAmount())
                .orderItems(result.getItems().stream()
                        .map(this::toOrderItemResponse)
                        .collect(Collectors.toList()))
                .createdAt(result.getCreatedAt())
                .updatedAt(result.getUpdatedAt())
                .build();
    }

    public OrderListResponse toOrderListResponse(OrderListResult result) {
        return OrderListResponse.builder()
                .orders(result.getOrders().stream()
                        .map(this::toOrderSummaryResponse)
                        .collect(Collectors.toList()))
                .totalOrders(result.getTotalOrders())
                .currentPage(result.getCurrentPage())
                .totalPages(result.getTotalPages())
                .build();
    }

    private OrderSummaryResponse toOrderSummaryResponse(OrderSummaryResult summary) {
        return OrderSummaryResponse.builder()
                .orderId(summary.getOrderId())
                .orderNumber(summary.getOrderNumber())
                .userId(summary.getUserId())
                .status(summary.getStatus().name())
                .totalAmount(summary.getTotalAmount())
                .itemCount(summary.getItemCount())
                .createdAt(summary.getCreatedAt())
                .build();
    }

    private OrderItemResponse toOrderItemResponse(OrderItemResult item) {
        return OrderItemResponse.builder()
                .orderItemId(item.getOrderItemId())
                .productId(item.getProductId())
                .productName(item.getProductName())
                .colorName(item.getColorName())
                .colorHex(item.getColorHex())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .lineTotal(item.getLineTotal())
                .build();
    }

    private ShippingAddress toShippingAddress(ShippingAddressRequest request) {
        return ShippingAddress.builder()
                .name(request.getName())
                .phone(request.getPhone())
                .email(request.getEmail())
                .address(request.getAddress())
                .city(request.getCity())
                .zipCode(request.getZipCode())
                .country(request.getCountry())
                .build();
    }

    private ShippingAddressResponse toShippingAddressResponse(ShippingAddress address) {
        if (address == null) {
            return null;
        }
        return ShippingAddressResponse.builder()
                .name(address.getName())
                .phone(address.getPhone())
                .email(address.getEmail())
                .address(address.getAddress())
                .city(address.getCity())
                .zipCode(address.getZipCode())
                .country(address.getCountry())
                .build();
    }

    private List<String> splitStatuses(String status) {
        if (status == null || status.isBlank()) {
            return List.of();
        }
        return Arrays.stream(status.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
