package com.furniro.store.domain.user;

import java.util.List;
import java.util.Optional;

/**
 * User Repository Interface (Domain Layer - Port)
 */
public interface UserRepository {

    /**
     * 사용자 조회 (삭제 여부 무관)
     */
    Optional<User> findById(Long userId);

    Optional<User> findByEmail(String email);

    /**
     * 삭제되지 않은 사용자 전체 조회 (가입일 최신순)
     */
    List<User> findAllActive();

    User save(User user);
}
