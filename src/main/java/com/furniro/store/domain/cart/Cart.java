package com.furniro.store.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Cart 도메인 엔티티
 * 사용자별 장바구니 (1:1 관계)
 *
 * 핵심 비즈니스 규칙:
 * - (상품 ID, 색상 hex) 조합당 항목은 최대 1개
 * - totalPrice는 CartPriceCalculator만 갱신 (applyTotals는 패키지 내부 전용)
 * - version으로 동시 수정 감지 (낙관적 락)
 */
@Entity
@Table(name = "carts", uniqueConstraints = {
    @UniqueConstraint(columnNames = "user_id")
})
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Cart {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_id")
    private Long cartId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "total_price", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalPrice;

    @Version
    @Column(name = "version")
    private Long version;

    @Getter(AccessLevel.NONE)
    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "cart_id", nullable = false)
    @OrderColumn(name = "line_order")
    @Builder.Default
    private List<CartItem> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 빈 장바구니 생성 (첫 담기 시점에 지연 생성)
     */
    public static Cart createCart(Long userId) {
        if (userId == null) {
            throw new IllegalArgumentException("사용자 ID는 필수입니다");
        }
        LocalDateTime now = LocalDateTime.now();
        return Cart.builder()
                .userId(userId)
                .totalPrice(BigDecimal.ZERO)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public List<CartItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * (상품 ID, 색상 hex) 조합으로 항목 조회
     */
    public Optional<CartItem> findItem(Long productId, String colorHex) {
        return this.items.stream()
                .filter(item -> item.matches(productId, colorHex))
                .findFirst();
    }

    /**
     * 새 항목 추가
     *
     * 동일 (상품, 색상) 항목이 이미 있으면 추가할 수 없습니다. 호출자는 findItem으로 병합 여부를 먼저 판단해야 합니다.
     */
    public void addItem(CartItem item) {
        if (item == null) {
            throw new IllegalArgumentException("null 항목을 추가할 수 없습니다");
        }
        if (findItem(item.getProductId(), item.getColorHex()).isPresent()) {
            throw new IllegalStateException("이미 존재하는 장바구니 항목입니다: " + item.getProductId() + "/" + item.getColorHex());
        }
        this.items.add(item);
        this.updatedAt = LocalDateTime.now();
    }

    public void removeItem(CartItem item) {
        this.items.remove(item);
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isEmpty() {
        return this.items.isEmpty();
    }

    public int getItemCount() {
        return this.items.size();
    }

    void applyTotals(BigDecimal totalPrice) {
        this.totalPrice = totalPrice;
        this.updatedAt = LocalDateTime.now();
    }
}
