package com.furniro.store.domain.cart;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 장바구니 담기 요청 항목이 형식에 맞지 않을 때 발생하는 예외 (상품 ID 누락 등)
 */
public class InvalidCartItemException extends DomainException {

    public InvalidCartItemException(String detailMessage) {
        super(ErrorCode.CART_INVALID_ITEM, detailMessage);
    }
}
