package com.furniro.store.application.user.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 관리자 사용자 수정 커맨드. 최소 하나의 필드가 필요
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateUserCommand {
    private String username;
    private String email;
    private String role;

    public boolean isEmpty() {
        return username == null && email == null && role == null;
    }
}
