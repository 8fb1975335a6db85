package com.furniro.store.presentation.user.mapper;

import com.furniro.store.application.user.dto.FavouriteProductResult;
import com.furniro.store.application.user.dto.UpdateProfileCommand;
import com.furniro.store.application.user.dto.UpdateUserCommand;
import com.furniro.store.application.user.dto.UserListResult;
import com.furniro.store.application.user.dto.UserResult;
import com.furniro.store.presentation.user.request.UpdateProfileRequest;
import com.furniro.store.presentation.user.request.UpdateUserRequest;
import com.furniro.store.presentation.user.response.FavouriteProductResponse;
import com.furniro.store.presentation.user.response.UserListResponse;
import com.furniro.store.presentation.user.response.UserResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * UserMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class UserMapper {

    public UpdateProfileCommand toUpdateProfileCommand(UpdateProfileRequest request) {
        return UpdateProfileCommand.builder()
                .fname(request.getFname())
                .lname(request.getLname())
                .phone(request.getPhone())
                .bio(request.getBio())
                .country(request.getCountry())
                .city(request.getCity())
                .build();
    }

    public UpdateUserCommand toUpdateUserCommand(UpdateUserRequest request) {
        if (request == null) {
            return null;
        }
        return UpdateUserCommand.builder()
                .username(request.getUsername())
                .email(request.getEmail())
                .role(request.getRole())
                .build();
    }

    public UserResponse toUserResponse(UserResult result) {
        return UserResponse.builder()
                .userId(result.getUserId())
                .username(result.getUsername())
                .email(result.getEmail())
                .phone(result.getPhone())
                .bio(result.getBio())
                .country(result.getCountry())
                .city(result.getCity())
                .role(result.getRole().name())
                .thumbnail(result.getThumbnail())
                .favourites(result.getFavourites())
                .createdAt(result.getCreatedAt())
                .updatedAt(result.getUpdatedAt())
                .build();
    }

    public UserListResponse toUserListResponse(UserListResult result) {
        return UserListResponse.builder()
                .totalUsers(result.getTotalUsers())
                .users(result.getUsers().stream()
                        .map(this::toUserResponse)
                        .collect(Collectors.toList()))
                .build();
    }

    public List<FavouriteProductResponse> toFavouriteProductResponses(List<FavouriteProductResult> results) {
        return results.stream()
                .map(r -> FavouriteProductResponse.builder()
                        .productId(r.getProductId())
                        .name(r.getName())
                        .subtitle(r.getSubtitle())
                        .image(r.getImage())
                        .build())
                .collect(Collectors.toList());
    }
}
