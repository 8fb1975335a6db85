package com.furniro.store.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 주문 목록 결과 (Application layer 내부 DTO)
 */
@Getter
@AllArgsConstructor
public class OrderListResult {
    private List<OrderSummaryResult> orders;
    private long totalOrders;
    private int currentPage;
    private int totalPages;
}
