package com.furniro.store.infrastructure.persistence.user;

import com.furniro.store.domain.user.User;
import com.furniro.store.domain.user.UserRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 User Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 */
@Repository
public class MySQLUserRepository implements UserRepository {

    private final UserJpaRepository userJpaRepository;

    public MySQLUserRepository(UserJpaRepository userJpaRepository) {
        this.userJpaRepository = userJpaRepository;
    }

    @Override
    public Optional<User> findById(Long userId) {
        return userJpaRepository.findById(userId);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return userJpaRepository.findByEmail(email);
    }

    @Override
    public List<User> findAllActive() {
        return userJpaRepository.findByDeletedFalseOrderByCreatedAtDescUserIdDesc();
    }

    @Override
    public User save(User user) {
        return userJpaRepository.save(user);
    }
}
