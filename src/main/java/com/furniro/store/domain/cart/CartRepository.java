package com.furniro.store.domain.cart;

import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface CartRepository {

    /**
     * 사용자의 장바구니 조회 (항목 포함)
     */
    Optional<Cart> findByUserId(Long userId);

    /**
     * 장바구니 저장 (생성 또는 수정, 항목 cascade)
     */
    Cart save(Cart cart);

    /**
     * 장바구니 삭제 (주문 완료 시)
     */
    void delete(Cart cart);

    /**
     * 보류 중인 변경(버전 검증 포함)을 즉시 DB에 반영
     */
    void flush();
}
