package com.furniro.store.domain.user;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * User 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 프로필 정보(이름, 연락처, 소개, 지역) 관리
 * - 계정 정보(이메일, 역할) 관리
 * - 관심 상품(favourites) 목록 관리
 *
 * 핵심 비즈니스 규칙:
 * - 이메일은 유일 (중복 검사는 UserService에서 수행)
 * - 프로필 수정 시 이름(fname)과 성(lname)은 필수
 * - 삭제는 소프트 삭제
 */
@Entity
@Table(name = "users", uniqueConstraints = {
    @UniqueConstraint(columnNames = "email")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "username")
    private String username;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "phone")
    private String phone;

    @Column(name = "bio", length = 2000)
    private String bio;

    @Column(name = "country")
    private String country;

    @Column(name = "city")
    private String city;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role;

    @Column(name = "thumbnail", length = 1000)
    private String thumbnail;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Getter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "user_favourites", joinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "favourite_order")
    @Column(name = "product_id", nullable = false)
    @Builder.Default
    private List<Long> favourites = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 사용자 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 이메일은 필수
     * - 역할 미지정 시 USER
     */
    public static User createUser(String username, String email, UserRole role) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("이메일은 필수입니다");
        }

        LocalDateTime now = LocalDateTime.now();
        return User.builder()
                .username(username)
                .email(email)
                .role(role == null ? UserRole.USER : role)
                .deleted(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 프로필 수정
     *
     * username은 "이름 성" 형태로 저장됩니다.
     *
     * @throws DomainException USER_INVALID_PROFILE 이름 또는 성 누락
     */
    public void updateProfile(String fname, String lname, String phone, String bio, String country, String city) {
        if (fname == null || fname.isBlank() || lname == null || lname.isBlank()) {
            throw new DomainException(ErrorCode.USER_INVALID_PROFILE);
        }
        this.username = (fname.trim() + " " + lname.trim()).trim();
        this.phone = phone;
        this.bio = bio;
        this.country = country;
        this.city = city;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 계정 정보 수정 (관리자). null 필드는 유지
     */
    public void updateAccount(String username, String email, UserRole role) {
        if (username != null) {
            this.username = username;
        }
        if (email != null) {
            this.email = email;
        }
        if (role != null) {
            this.role = role;
        }
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 관심 상품 토글
     *
     * @return 추가되었으면 true, 제거되었으면 false
     */
    public boolean toggleFavourite(Long productId) {
        boolean added;
        if (this.favourites.contains(productId)) {
            this.favourites.remove(productId);
            added = false;
        } else {
            this.favourites.add(productId);
            added = true;
        }
        this.updatedAt = LocalDateTime.now();
        return added;
    }

    public List<Long> getFavourites() {
        return Collections.unmodifiableList(favourites);
    }

    public void softDelete() {
        this.deleted = true;
        this.updatedAt = LocalDateTime.now();
    }
}
