package com.furniro.store.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 추가 커맨드 (Application layer 내부 DTO)
 * colorHex가 없으면 상품의 첫 번째 색상
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemCommand {
    private Long productId;
    private Integer quantity;
    private String colorHex;
}
