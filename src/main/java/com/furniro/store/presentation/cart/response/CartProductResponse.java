package com.furniro.store.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 장바구니 항목 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartProductResponse {

    @JsonProperty("id")
    private Long productId;

    @JsonProperty("name")
    private String productName;

    @JsonProperty("color_name")
    private String colorName;

    @JsonProperty("color_hex")
    private String colorHex;

    @JsonProperty("image")
    private String imageUrl;

    @JsonProperty("price")
    private BigDecimal unitPrice;

    private Integer quantity;

    @JsonProperty("available_quantity")
    private Integer availableQuantity;

    private BigDecimal subtotal;
}
