package com.furniro.store.domain.cart;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 빈 장바구니(또는 장바구니 없음)로 주문을 시도할 때 발생하는 예외
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(Long userId) {
        super(ErrorCode.CART_EMPTY, "사용자 ID: " + userId);
    }
}
