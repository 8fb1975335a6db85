package com.furniro.store.infrastructure.persistence.user;

import com.furniro.store.domain.user.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * User JPA Repository
 * Spring Data JPA를 통한 User 엔티티 영구 저장소
 */
public interface UserJpaRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    List<User> findByDeletedFalseOrderByCreatedAtDescUserIdDesc();
}
