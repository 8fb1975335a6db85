package com.furniro.store.application.store.dto;

import com.furniro.store.domain.store.Currency;
import com.furniro.store.domain.store.Language;
import com.furniro.store.domain.store.ShippingMethod;
import com.furniro.store.domain.store.StoreSettings;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 스토어 설정 조회 결과 (활성 상태이며 삭제되지 않은 항목만 포함)
 */
@Getter
@AllArgsConstructor
public class StoreConfigResult {
    private String storeName;
    private String defaultCurrency;
    private String defaultLanguage;
    private List<CurrencyResult> currencies;
    private List<LanguageResult> languages;
    private List<ShippingMethodResult> shippingMethods;

    public static StoreConfigResult of(StoreSettings settings, List<Currency> currencies,
                                       List<Language> languages, List<ShippingMethod> shippingMethods) {
        return new StoreConfigResult(
                settings.getStoreName(),
                settings.getDefaultCurrency(),
                settings.getDefaultLanguage(),
                currencies.stream()
                        .map(c -> new CurrencyResult(c.getCode(), c.getSymbol(), c.getName(),
                                c.getExchangeRate(), c.isDefault(), c.isActive()))
                        .collect(Collectors.toList()),
                languages.stream()
                        .map(l -> new LanguageResult(l.getCode(), l.getName(), l.isDefault(), l.isActive()))
                        .collect(Collectors.toList()),
                shippingMethods.stream()
                        .map(s -> new ShippingMethodResult(s.getShippingMethodId(), s.getName(), s.getCost(), s.isActive()))
                        .collect(Collectors.toList()));
    }

    @Getter
    @AllArgsConstructor
    public static class CurrencyResult {
        private String code;
        private String symbol;
        private String name;
        private BigDecimal exchangeRate;
        private boolean isDefault;
        private boolean isActive;
    }

    @Getter
    @AllArgsConstructor
    public static class LanguageResult {
        private String code;
        private String name;
        private boolean isDefault;
        private boolean isActive;
    }

    @Getter
    @AllArgsConstructor
    public static class ShippingMethodResult {
        private Long id;
        private String name;
        private BigDecimal cost;
        private boolean isActive;
    }
}
