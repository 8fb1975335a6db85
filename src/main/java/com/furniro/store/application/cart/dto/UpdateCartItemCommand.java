package com.furniro.store.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 수량 수정 커맨드 (Application layer 내부 DTO)
 * color는 hex 코드 또는 색상명, quantity 0은 항목 제거
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateCartItemCommand {
    private Long productId;
    private Integer quantity;
    private String color;
}
