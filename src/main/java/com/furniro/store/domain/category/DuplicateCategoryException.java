package com.furniro.store.domain.category;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 같은 이름의 카테고리가 이미 존재할 때 발생하는 예외
 */
public class DuplicateCategoryException extends DomainException {

    public DuplicateCategoryException(String name) {
        super(ErrorCode.CATEGORY_DUPLICATE, "이름: " + name);
    }
}
