package com.furniro.store.application.cart.dto;

import com.furniro.store.domain.cart.CartPricing;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@AllArgsConstructor
public class CartResult {
    private List<CartLineResult> lines;
    private BigDecimal totalPrice;

    public static CartResult from(CartPricing pricing) {
        List<CartLineResult> lines = pricing.getLines().stream()
                .map(CartLineResult::from)
                .collect(Collectors.toList());
        return new CartResult(lines, pricing.getTotalPrice());
    }
}
