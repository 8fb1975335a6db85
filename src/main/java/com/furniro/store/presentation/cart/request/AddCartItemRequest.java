package com.furniro.store.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 담기 요청 항목 DTO
 * 요청 본문은 이 항목의 배열입니다. color_hex가 없으면 첫 번째 색상
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {

    @JsonProperty("id")
    private Long productId;

    private Integer quantity;

    @JsonProperty("color_hex")
    private String colorHex;
}
