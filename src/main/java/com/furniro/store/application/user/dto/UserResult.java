package com.furniro.store.application.user.dto;

import com.furniro.store.domain.user.User;
import com.furniro.store.domain.user.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Builder
@AllArgsConstructor
public class UserResult {
    private Long userId;
    private String username;
    private String email;
    private String phone;
    private String bio;
    private String country;
    private String city;
    private UserRole role;
    private String thumbnail;
    private List<Long> favourites;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static UserResult from(User user) {
        return UserResult.builder()
                .userId(user.getUserId())
                .username(user.getUsername())
                .email(user.getEmail())
                .phone(user.getPhone())
                .bio(user.getBio())
                .country(user.getCountry())
                .city(user.getCity())
                .role(user.getRole())
                .thumbnail(user.getThumbnail())
                .favourites(new ArrayList<>(user.getFavourites()))
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
