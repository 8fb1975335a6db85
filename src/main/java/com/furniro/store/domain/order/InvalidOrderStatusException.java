package com.furniro.store.domain.order;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 알 수 없는 주문 상태 값일 때 발생하는 예외
 */
public class InvalidOrderStatusException extends DomainException {

    public InvalidOrderStatusException(String status) {
        super(ErrorCode.INVALID_ORDER_STATUS, "입력값: " + status);
    }
}
