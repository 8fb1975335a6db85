package com.furniro.store.presentation.order;

import com.furniro.store.application.order.OrderService;
import com.furniro.store.presentation.order.mapper.OrderMapper;
import com.furniro.store.presentation.order.response.OrderDetailResponse;
import com.furniro.store.presentation.order.response.OrderListResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * OrderController - Presentation 계층
 * 사용자 주문 조회
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    /**
     * GET /orders - 내 주문 목록 (최신순)
     */
    @GetMapping
    public ResponseEntity<OrderListResponse> getOrders(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(orderMapper.toOrderListResponse(orderService.getUserOrders(userId, page, limit)));
    }

    /**
     * GET /orders/{orderId} - 주문 상세
     */
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderDetailResponse> getOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable Long orderId) {
        return ResponseEntity.ok(orderMapper.toOrderDetailResponse(orderService.getOrderDetail(userId, orderId)));
    }
}
