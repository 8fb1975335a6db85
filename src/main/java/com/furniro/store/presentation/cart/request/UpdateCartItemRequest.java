package com.furniro.store.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 수량 수정 요청 DTO
 * color는 hex 코드 또는 색상명, quantity 0은 항목 제거
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateCartItemRequest {

    @NotNull(message = "상품 ID는 필수입니다")
    @JsonProperty("id")
    private Long productId;

    @NotNull(message = "수량은 필수입니다")
    @Min(value = 0, message = "수정 수량은 0 이상이어야 합니다")
    private Integer quantity;

    private String color;
}
