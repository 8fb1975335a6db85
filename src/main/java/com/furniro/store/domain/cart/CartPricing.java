package com.furniro.store.domain.cart;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 조회용 가격 산출 결과
 * totalPrice = Σ lines.subtotal
 */
@Getter
@AllArgsConstructor
public class CartPricing {
    private final List<PricedCartLine> lines;
    private final BigDecimal totalPrice;
}
