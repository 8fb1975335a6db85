package com.furniro.store.domain.cart;

import com.furniro.store.domain.product.VariantInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 현재 카탈로그 기준으로 가격이 매겨진 장바구니 라인
 */
@Getter
@AllArgsConstructor
public class PricedCartLine {
    private final VariantInfo variant;
    private final int quantity;
    private final BigDecimal subtotal;
}
