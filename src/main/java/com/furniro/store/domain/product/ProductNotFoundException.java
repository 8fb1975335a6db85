package com.furniro.store.domain.product;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * ProductNotFoundException - 상품을 찾을 수 없을 때 발생하는 예외 (Domain 계층)
 *
 * 존재하지 않거나 소프트 삭제된 상품을 조회한 경우 발생하며
 * GlobalExceptionHandler에서 404 Not Found로 변환됩니다.
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "상품 ID: " + productId);
    }

    public ProductNotFoundException(String detailMessage) {
        super(ErrorCode.PRODUCT_NOT_FOUND, detailMessage);
    }
}
