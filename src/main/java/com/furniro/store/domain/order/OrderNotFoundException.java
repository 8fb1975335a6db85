package com.furniro.store.domain.order;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 주문을 찾을 수 없을 때 발생하는 예외
 */
public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(Long orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order ID: " + orderId);
    }

    public OrderNotFoundException(String detailMessage) {
        super(ErrorCode.ORDER_NOT_FOUND, detailMessage);
    }
}
