package com.furniro.store.domain.order;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * 배송지 (Order에 포함되는 값 객체)
 */
@Embeddable
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingAddress {

    @Column(name = "shipping_name")
    private String name;

    @Column(name = "shipping_phone")
    private String phone;

    @Column(name = "shipping_email")
    private String email;

    @Column(name = "shipping_address")
    private String address;

    @Column(name = "shipping_city")
    private String city;

    @Column(name = "shipping_zip_code")
    private String zipCode;

    @Column(name = "shipping_country")
    private String country;
}
