package com.furniro.store.presentation.product.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 최저가/최고가 응답
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PriceResponse {
    private BigDecimal price;
}
