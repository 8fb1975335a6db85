package com.furniro.store.domain.cart;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 사용자의 장바구니가 존재하지 않을 때 발생하는 예외
 */
public class CartNotFoundException extends DomainException {

    public CartNotFoundException(Long userId) {
        super(ErrorCode.CART_NOT_FOUND, "사용자 ID: " + userId);
    }
}
