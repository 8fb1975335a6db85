package com.furniro.store.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문 항목 스냅샷 보관
 * - 배송지, 결제 수단, 거래 번호 보관
 * - 주문 상태 관리
 *
 * 핵심 비즈니스 규칙:
 * - 주문 생성 시 최소 1개 이상의 항목 필요
 * - totalAmount = Σ 항목 lineTotal
 * - 생성 후 변경 가능한 값은 상태(status)뿐
 */
@Entity
@Table(name = "orders", uniqueConstraints = {
    @UniqueConstraint(columnNames = "order_number")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "order_number", nullable = false, length = 32)
    private String orderNumber;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Embedded
    private ShippingAddress shippingAddress;

    @Column(name = "payment_method")
    private String paymentMethod;

    @Column(name = "transaction_id")
    private String transactionId;

    @Column(name = "total_amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 주문 항목 관계
     * 주문과 생명주기를 같이하므로 cascade ALL
     */
    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드 (정적 팩토리)
     *
     * 비즈니스 규칙:
     * - 항목은 1개 이상
     * - 초기 상태는 PENDING
     * - totalAmount는 항목 lineTotal의 합
     */
    public static Order createOrder(Long userId, String orderNumber, ShippingAddress shippingAddress,
                                    String paymentMethod, String transactionId, List<OrderItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("주문 항목은 최소 1개 이상이어야 합니다");
        }

        BigDecimal totalAmount = items.stream()
                .map(OrderItem::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        LocalDateTime now = LocalDateTime.now();
        Order order = Order.builder()
                .userId(userId)
                .orderNumber(orderNumber)
                .status(OrderStatus.PENDING)
                .shippingAddress(shippingAddress)
                .paymentMethod(paymentMethod)
                .transactionId(transactionId)
                .totalAmount(totalAmount)
                .createdAt(now)
                .updatedAt(now)
                .build();
        order.orderItems.addAll(items);
        return order;
    }

    /**
     * 상태 변경 (관리자)
     */
    public void changeStatus(OrderStatus newStatus) {
        if (newStatus == null) {
            throw new InvalidOrderStatusException((String) null);
        }
        this.status = newStatus;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    /**
     * 주문 항목 개수
     */
    public int getOrderItemCount() {
        return this.orderItems.size();
    }

    /**
     * 총 항목 수량 계산
     */
    public Integer getTotalQuantity() {
        return this.orderItems.stream()
                .mapToInt(OrderItem::getQuantity)
                .sum();
    }
}
