package com.furniro.store.domain.order;

import lombok.Getter;

/**
 * OrderStatus - 도메인 값 객체 (Enum)
 *
 * 주문의 생명주기 상태를 나타냅니다.
 * - PENDING: 주문 접수 (생성 직후)
 * - PROCESSING: 주문 처리 중
 * - SHIPPED: 배송 중
 * - DELIVERED: 배송 완료
 * - CANCELLED: 주문 취소
 *
 * 상태 전환은 관리자 조작으로만 일어나며 전환 순서를 강제하지 않습니다.
 */
@Getter
public enum OrderStatus {
    PENDING("주문 접수"),
    PROCESSING("처리 중"),
    SHIPPED("배송 중"),
    DELIVERED("배송 완료"),
    CANCELLED("주문 취소");

    private final String displayName;

    OrderStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 문자열에서 OrderStatus로 변환 (대소문자 무시)
     *
     * @throws InvalidOrderStatusException 알 수 없는 상태 값
     */
    public static OrderStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            throw new InvalidOrderStatusException(status);
        }
        try {
            return OrderStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidOrderStatusException(status);
        }
    }
}
