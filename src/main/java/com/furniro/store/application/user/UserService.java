package com.furniro.store.application.user;

import com.furniro.store.application.common.Pagination;
import com.furniro.store.application.user.dto.*;
import com.furniro.store.common.exception.ApplicationException;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.ProductNotFoundException;
import com.furniro.store.domain.product.ProductRepository;
import com.furniro.store.domain.user.*;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * UserService - 사용자 프로필, 관리자 계정 관리, 관심 상품 (Application 계층)
 *
 * 삭제된 사용자는 모든 조회/수정에서 존재하지 않는 사용자로 취급합니다.
 */
@Service
public class UserService {

    private final UserRepository userRepository;
    private final ProductRepository productRepository;
    private final StoreProperties storeProperties;

    public UserService(UserRepository userRepository,
                       ProductRepository productRepository,
                       StoreProperties storeProperties) {
        this.userRepository = userRepository;
        this.productRepository = productRepository;
        this.storeProperties = storeProperties;
    }

    @Transactional(readOnly = true)
    public UserResult getUser(Long userId) {
        return UserResult.from(findActiveUser(userId));
    }

    /**
     * 프로필 수정 (본인)
     */
    @Transactional
    public UserResult updateProfile(Long userId, UpdateProfileCommand command) {
        User user = findActiveUser(userId);
        user.updateProfile(command.getFname(), command.getLname(), command.getPhone(),
                command.getBio(), command.getCountry(), command.getCity());
        return UserResult.from(userRepository.save(user));
    }

    /**
     * 계정 정보 수정 (관리자)
     *
     * @throws ApplicationException NO_FIELDS_TO_UPDATE 수정할 필드 없음
     * @throws DuplicateEmailException 다른 사용자가 사용 중인 이메일
     */
    @Transactional
    public UserResult updateUser(Long userId, UpdateUserCommand command) {
        if (command == null || command.isEmpty()) {
            throw new ApplicationException(ErrorCode.NO_FIELDS_TO_UPDATE);
        }
        User user = findActiveUser(userId);

        if (command.getEmail() != null) {
            userRepository.findByEmail(command.getEmail())
                    .filter(other -> !other.getUserId().equals(userId))
                    .ifPresent(other -> {
                        throw new DuplicateEmailException(command.getEmail());
                    });
        }
        UserRole role = command.getRole() == null ? null : UserRole.fromString(command.getRole());

        user.updateAccount(command.getUsername(), command.getEmail(), role);
        return UserResult.from(userRepository.save(user));
    }

    /**
     * 사용자 삭제 (소프트 삭제)
     */
    @Transactional
    public void deleteUser(Long userId) {
        User user = findActiveUser(userId);
        user.softDelete();
        userRepository.save(user);
    }

    /**
     * 관심 상품 토글
     *
     * @return 변경 후 관심 상품 ID 목록
     */
    @Transactional
    public List<Long> toggleFavourite(Long userId, Long productId) {
        if (productId == null) {
            throw new ApplicationException(ErrorCode.INVALID_REQUEST, "상품 ID는 필수입니다");
        }
        User user = findActiveUser(userId);
        productRepository.findById(productId)
                .filter(p -> !p.isDeleted())
                .orElseThrow(() -> new ProductNotFoundException(productId));

        user.toggleFavourite(productId);
        return new ArrayList<>(userRepository.save(user).getFavourites());
    }

    /**
     * 관심 상품 목록 (저장된 순서 유지, 조회할 수 없는 상품은 제외)
     */
    @Transactional(readOnly = true)
    public List<FavouriteProductResult> getFavourites(Long userId) {
        User user = findActiveUser(userId);
        Map<Long, Product> products = productRepository.findAllByIds(user.getFavourites()).stream()
                .filter(p -> !p.isDeleted())
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        return user.getFavourites().stream()
                .filter(products::containsKey)
                .map(id -> FavouriteProductResult.from(products.get(id)))
                .collect(Collectors.toList());
    }

    /**
     * 사용자 목록 (관리자)
     *
     * @param search 사용자명 부분 일치 (대소문자 무시)
     * @param role 역할 필터
     */
    @Transactional(readOnly = true)
    public UserListResult getUsers(Integer page, Integer limit, String search, String role) {
        Pagination pagination = Pagination.of(page, limit, storeProperties);
        UserRole roleFilter = role == null || role.isBlank() ? null : UserRole.fromString(role);
        String keyword = search == null ? "" : search.trim().toLowerCase();

        List<User> filtered = userRepository.findAllActive().stream()
                .filter(u -> keyword.isEmpty()
                        || (u.getUsername() != null && u.getUsername().toLowerCase().contains(keyword)))
                .filter(u -> roleFilter == null || u.getRole() == roleFilter)
                .collect(Collectors.toList());

        List<UserResult> users = pagination.slice(filtered).stream()
                .map(UserResult::from)
                .collect(Collectors.toList());
        return new UserListResult(filtered.size(), users);
    }

    private User findActiveUser(Long userId) {
        return userRepository.findById(userId)
                .filter(u -> !u.isDeleted())
                .orElseThrow(() -> new UserNotFoundException(userId));
    }
}
