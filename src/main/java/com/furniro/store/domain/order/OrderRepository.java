package com.furniro.store.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * OrderRepository - Order 도메인 영속성 Port Interface
 * 주문 데이터의 저장 및 조회를 담당
 */
public interface OrderRepository {
    /**
     * 주문 저장
     */
    Order save(Order order);

    /**
     * 주문 ID로 조회 (항목 포함)
     */
    Optional<Order> findById(Long orderId);

    /**
     * 사용자별 주문 목록 조회 (최신순, 페이지네이션)
     *
     * @param page 1부터 시작하는 페이지 번호
     */
    List<Order> findByUserId(Long userId, int page, int size);

    /**
     * 사용자의 주문 총 개수 조회
     */
    long countByUserId(Long userId);

    /**
     * 관리자 조건 검색 (정렬, 페이지네이션 포함)
     */
    List<Order> search(OrderSearchCondition condition);

    /**
     * 관리자 조건 검색 결과 총 개수
     */
    long count(OrderSearchCondition condition);
}
