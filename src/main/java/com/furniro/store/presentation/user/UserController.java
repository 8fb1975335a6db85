package com.furniro.store.presentation.user;

import com.furniro.store.application.user.UserService;
import com.furniro.store.presentation.user.mapper.UserMapper;
import com.furniro.store.presentation.user.request.ToggleFavouriteRequest;
import com.furniro.store.presentation.user.request.UpdateProfileRequest;
import com.furniro.store.presentation.user.request.UpdateUserRequest;
import com.furniro.store.presentation.user.response.FavouriteProductResponse;
import com.furniro.store.presentation.user.response.FavouritesResponse;
import com.furniro.store.presentation.user.response.UserListResponse;
import com.furniro.store.presentation.user.response.UserResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * UserController - Presentation 계층
 *
 * /profile, /favourites는 X-USER-ID 헤더의 사용자 본인 기준,
 * 나머지는 관리자용 엔드포인트입니다.
 */
@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;
    private final UserMapper userMapper;

    public UserController(UserService userService, UserMapper userMapper) {
        this.userService = userService;
        this.userMapper = userMapper;
    }

    @GetMapping("/profile")
    public ResponseEntity<UserResponse> getProfile(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(userMapper.toUserResponse(userService.getUser(userId)));
    }

    /**
     * PUT /users/profile - 프로필 수정 (username = "fname lname")
     */
    @PutMapping("/profile")
    public ResponseEntity<UserResponse> updateProfile(
            @RequestHeader("X-USER-ID") Long userId,
            @Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(userMapper.toUserResponse(
                userService.updateProfile(userId, userMapper.toUpdateProfileCommand(request))));
    }

    @GetMapping("/favourites")
    public ResponseEntity<List<FavouriteProductResponse>> getFavourites(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(userMapper.toFavouriteProductResponses(userService.getFavourites(userId)));
    }

    /**
     * POST /users/favourites/toggle - 관심 상품 추가/제거
     */
    @PostMapping("/favourites/toggle")
    public ResponseEntity<FavouritesResponse> toggleFavourite(
            @RequestHeader("X-USER-ID") Long userId,
            @Valid @RequestBody ToggleFavouriteRequest request) {
        return ResponseEntity.ok(new FavouritesResponse(
                userService.toggleFavourite(userId, request.getProductId())));
    }

    /**
     * GET /users - 사용자 목록 (관리자)
     */
    @GetMapping
    public ResponseEntity<UserListResponse> getUsers(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String role) {
        return ResponseEntity.ok(userMapper.toUserListResponse(userService.getUsers(page, limit, search, role)));
    }

    @GetMapping("/{userId:\\d+}")
    public ResponseEntity<UserResponse> getUser(@PathVariable Long userId) {
        return ResponseEntity.ok(userMapper.toUserResponse(userService.getUser(userId)));
    }

    @PatchMapping("/{userId:\\d+}")
    public ResponseEntity<UserResponse> updateUser(
            @PathVariable Long userId,
            @RequestBody(required = false) UpdateUserRequest request) {
        return ResponseEntity.ok(userMapper.toUserResponse(
                userService.updateUser(userId, userMapper.toUpdateUserCommand(request))));
    }

    @DeleteMapping("/{userId:\\d+}")
    public ResponseEntity<Void> deleteUser(@PathVariable Long userId) {
        userService.deleteUser(userId);
        return ResponseEntity.noContent().build();
    }
}
