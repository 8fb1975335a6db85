package com.furniro.store.presentation.order;

import com.furniro.store.application.order.OrderService;
import com.furniro.store.presentation.order.mapper.OrderMapper;
import com.furniro.store.presentation.order.request.UpdateOrderStatusRequest;
import com.furniro.store.presentation.order.response.OrderDetailResponse;
import com.furniro.store.presentation.order.response.OrderListResponse;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * AdminOrderController - 관리자 주문 검색 및 상태 변경
 */
@RestController
@RequestMapping("/admin/orders")
public class AdminOrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public AdminOrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    /**
     * GET /admin/orders - 조건 검색
     */
    @GetMapping
    public ResponseEntity<OrderListResponse> searchOrders(
            @RequestParam(name = "user_id", required = false) Long userId,
            @RequestParam(name = "search_query", required = false) String searchQuery,
            @RequestParam(required = false) String status,
            @RequestParam(name = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "min_amount", required = false) BigDecimal minAmount,
            @RequestParam(name = "max_amount", required = false) BigDecimal maxAmount,
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @RequestParam(name = "sort_order", required = false) String sortOrder,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(orderMapper.toOrderListResponse(orderService.searchOrders(
                orderMapper.toAdminOrderSearchCommand(userId, searchQuery, status, startDate, endDate,
                        minAmount, maxAmount, sortBy, sortOrder, page, limit))));
    }

    /**
     * PATCH /admin/orders/{orderId}/status - 주문 상태 변경
     */
    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderDetailResponse> changeStatus(
            @PathVariable Long orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request) {
        return ResponseEntity.ok(orderMapper.toOrderDetailResponse(
                orderService.changeStatus(orderId, request.getStatus())));
    }
}
