package com.furniro.store.domain.product;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 상품에 요청한 색상이 없거나, 상품에 등록된 색상이 하나도 없을 때 발생하는 예외
 */
public class InvalidColorException extends DomainException {

    public InvalidColorException(Long productId, String color) {
        super(ErrorCode.INVALID_COLOR, String.format("상품 ID: %d, 색상: %s", productId, color));
    }

    public InvalidColorException(Long productId) {
        super(ErrorCode.INVALID_COLOR, String.format("상품 ID: %d에 등록된 색상이 없습니다", productId));
    }
}
