package com.furniro.store.domain.user;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 사용자를 찾을 수 없을 때 발생하는 예외 (삭제된 사용자 포함)
 */
public class UserNotFoundException extends DomainException {

    public UserNotFoundException(Long userId) {
        super(ErrorCode.USER_NOT_FOUND, "사용자 ID: " + userId);
    }
}
