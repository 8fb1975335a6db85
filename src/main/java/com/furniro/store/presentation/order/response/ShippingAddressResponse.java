package com.furniro.store.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingAddressResponse {
    private String name;
    private String phone;
    private String email;
    private String address;
    private String city;

    @JsonProperty("zip_code")
    private String zipCode;

    private String country;
}
