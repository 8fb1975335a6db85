package com.furniro.store.presentation.order;

import com.furniro.store.application.order.CheckoutService;
import com.furniro.store.application.order.dto.OrderResult;
import com.furniro.store.presentation.order.mapper.OrderMapper;
import com.furniro.store.presentation.order.request.PlaceOrderRequest;
import com.furniro.store.presentation.order.response.OrderDetailResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CheckoutController - Presentation 계층
 * 장바구니를 주문으로 전환
 */
@RestController
@RequestMapping("/checkout")
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final OrderMapper orderMapper;

    public CheckoutController(CheckoutService checkoutService, OrderMapper orderMapper) {
        this.checkoutService = checkoutService;
        this.orderMapper = orderMapper;
    }

    /**
     * POST /checkout - 주문 생성
     */
    @PostMapping
    public ResponseEntity<OrderDetailResponse> placeOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @Valid @RequestBody PlaceOrderRequest request) {
        OrderResult result = checkoutService.placeOrder(userId, orderMapper.toPlaceOrderCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(orderMapper.toOrderDetailResponse(result));
    }
}
