package com.furniro.store.application.order.dto;

import com.furniro.store.domain.order.ShippingAddress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 커맨드 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderCommand {
    private ShippingAddress shippingAddress;
    private String paymentMethod;
    private String transactionId;
}
