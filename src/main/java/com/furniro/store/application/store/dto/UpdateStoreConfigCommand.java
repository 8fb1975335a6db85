package com.furniro.store.application.store.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 스토어 설정 수정 커맨드
 *
 * 목록 필드(currencies, languages, shippingMethods)가 null이면 해당 목록은 변경하지 않습니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStoreConfigCommand {
    private String storeName;
    private String defaultCurrency;
    private String defaultLanguage;
    private List<CurrencyCommand> currencies;
    private List<LanguageCommand> languages;
    private List<ShippingMethodCommand> shippingMethods;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrencyCommand {
        private String code;
        private String symbol;
        private String name;
        private BigDecimal exchangeRate;
        private Boolean isDefault;
        private Boolean isActive;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LanguageCommand {
        private String code;
        private String name;
        private Boolean isDefault;
        private Boolean isActive;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ShippingMethodCommand {
        private Long id;
        private String name;
        private BigDecimal cost;
        private Boolean isActive;
    }
}
