package com.furniro.store.domain.category;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 카테고리를 찾을 수 없을 때 발생하는 예외
 */
public class CategoryNotFoundException extends DomainException {

    public CategoryNotFoundException(Long categoryId) {
        super(ErrorCode.CATEGORY_NOT_FOUND, "카테고리 ID: " + categoryId);
    }

    public CategoryNotFoundException(String detailMessage) {
        super(ErrorCode.CATEGORY_NOT_FOUND, detailMessage);
    }
}
