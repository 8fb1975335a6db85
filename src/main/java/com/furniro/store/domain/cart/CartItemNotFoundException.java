package com.furniro.store.domain.cart;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 장바구니에 (상품, 색상) 항목이 없을 때 발생하는 예외
 */
public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(Long productId, String colorHex) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, String.format("상품 ID: %d, 색상: %s", productId, colorHex));
    }
}
