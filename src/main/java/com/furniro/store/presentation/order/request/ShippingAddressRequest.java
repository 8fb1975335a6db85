package com.furniro.store.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingAddressRequest {

    @NotBlank(message = "수령인 이름은 필수입니다")
    private String name;

    private String phone;

    private String email;

    @NotBlank(message = "배송 주소는 필수입니다")
    private String address;

    private String city;

    @JsonProperty("zip_code")
    private String zipCode;

    private String country;
}
