package com.furniro.store.domain.user;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 다른 사용자가 이미 사용 중인 이메일로 변경할 때 발생하는 예외
 */
public class DuplicateEmailException extends DomainException {

    public DuplicateEmailException(String email) {
        super(ErrorCode.USER_EMAIL_DUPLICATE, "이메일: " + email);
    }
}
