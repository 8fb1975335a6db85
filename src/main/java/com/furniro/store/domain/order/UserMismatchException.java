package com.furniro.store.domain.order;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 다른 사용자의 주문에 접근할 때 발생하는 예외
 */
public class UserMismatchException extends DomainException {

    public UserMismatchException(Long orderId, Long userId) {
        super(ErrorCode.USER_MISMATCH, String.format("Order ID: %d, User ID: %d", orderId, userId));
    }
}
