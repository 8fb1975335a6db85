package com.furniro.store.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 관리자 주문 검색 커맨드 (Application layer 내부 DTO)
 *
 * 날짜는 양 끝을 포함합니다. statuses는 쉼표로 구분된 요청 값을 분리한 문자열 목록입니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminOrderSearchCommand {
    private Long userId;
    private String searchQuery;
    private List<String> statuses;
    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal minAmount;
    private BigDecimal maxAmount;
    private String sortBy;
    private String sortOrder;
    private Integer page;
    private Integer limit;
}
