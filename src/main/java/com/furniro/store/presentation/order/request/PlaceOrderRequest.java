package com.furniro.store.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성(체크아웃) 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {

    @Valid
    @NotNull(message = "배송지는 필수입니다")
    @JsonProperty("shipping_address")
    private ShippingAddressRequest shippingAddress;

    @NotBlank(message = "결제 수단은 필수입니다")
    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("transaction_id")
    private String transactionId;
}
