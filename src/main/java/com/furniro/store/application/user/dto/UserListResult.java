package com.furniro.store.application.user.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class UserListResult {
    private long totalUsers;
    private List<UserResult> users;
}
