package com.furniro.store.presentation.store.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 스토어 설정 수정 요청 DTO
 *
 * 목록 필드를 생략하면 해당 목록은 변경되지 않고,
 * 빈 배열을 보내면 기존 항목이 모두 소프트 삭제됩니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStoreConfigRequest {

    @JsonProperty("store_name")
    private String storeName;

    @JsonProperty("default_currency")
    private String defaultCurrency;

    @JsonProperty("default_language")
    private String defaultLanguage;

    @Valid
    private List<CurrencyRequest> currencies;

    @Valid
    private List<LanguageRequest> languages;

    @Valid
    @JsonProperty("shipping_methods")
    private List<ShippingMethodRequest> shippingMethods;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrencyRequest {

        @NotBlank(message = "통화 코드는 필수입니다")
        private String code;

        private String symbol;

        private String name;

        @DecimalMin(value = "0", message = "환율은 0 이상이어야 합니다")
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
    public static class LanguageRequest {

        @NotBlank(message = "언어 코드는 필수입니다")
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
    public static class ShippingMethodRequest {

        private Long id;

        @NotBlank(message = "배송 방법 이름은 필수입니다")
        private String name;

        @DecimalMin(value = "0", message = "배송비는 0 이상이어야 합니다")
        private BigDecimal cost;

        @JsonProperty("is_active")
        private Boolean isActive;
    }
}
