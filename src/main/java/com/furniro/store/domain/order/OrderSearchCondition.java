package com.furniro.store.domain.order;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 관리자 주문 검색 조건
 *
 * null 필드는 조건에서 제외됩니다. statuses가 비어 있으면 전체 상태를 대상으로 합니다.
 * createdFrom은 포함, createdTo는 제외 경계입니다.
 */
@Getter
@Builder
public class OrderSearchCondition {
    private final Long userId;
    private final String orderNumberKeyword;
    private final List<OrderStatus> statuses;
    private final LocalDateTime createdFrom;
    private final LocalDateTime createdTo;
    private final BigDecimal minAmount;
    private final BigDecimal maxAmount;
    private final OrderSortField sortField;
    private final boolean ascending;
    private final int page;
    private final int size;
}
