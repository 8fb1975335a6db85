package com.furniro.store.domain.user;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;

/**
 * 사용자 역할
 */
public enum UserRole {
    USER,
    ADMIN,
    MANAGER,
    SUPPORT,
    EDITOR;

    /**
     * 문자열에서 역할로 변환 (대소문자 무시)
     *
     * @throws DomainException USER_INVALID_ROLE
     */
    public static UserRole fromString(String value) {
        if (value != null) {
            for (UserRole role : values()) {
                if (role.name().equalsIgnoreCase(value.trim())) {
                    return role;
                }
            }
        }
        throw new DomainException(ErrorCode.USER_INVALID_ROLE, "입력값: " + value);
    }
}
