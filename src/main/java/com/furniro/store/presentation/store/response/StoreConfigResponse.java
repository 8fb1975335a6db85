package com.furniro.store.presentation.store.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 스토어 설정 응답 DTO (활성 통화, 언어, 배송 방법 포함)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreConfigResponse {

    @JsonProperty("store_name")
    private String storeName;

    @JsonProperty("default_currency")
    private String defaultCurrency;

    @JsonProperty("default_language")
    private String defaultLanguage;

    private List<CurrencyResponse> currencies;

    private List<LanguageResponse> languages;

    @JsonProperty("shipping_methods")
    private List<ShippingMethodResponse> shippingMethods;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrencyResponse {
        private String code;
        private String symbol;
        private String name;

        @JsonProperty("exchange_rate")
        private BigDecimal exchangeRate;

        @JsonProperty("is_default")
        private Boolean isDefault;

        @JsonProperty("is_active")
        private Boolean isActive;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LanguageResponse {
        private String code;
        private String name;

        @JsonProperty("is_default")
        private Boolean isDefault;

        @JsonProperty("is_active")
        private Boolean isActive;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ShippingMethodResponse {
        private Long id;
        private String name;
        private BigDecimal cost;

        @JsonProperty("is_active")
        private Boolean isActive;
    }
}
