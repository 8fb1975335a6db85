package com.furniro.store.presentation.store.mapper;

import com.furniro.store.application.store.dto.StoreConfigResult;
import com.furniro.store.application.store.dto.UpdateStoreConfigCommand;
import com.furniro.store.presentation.store.request.UpdateStoreConfigRequest;
import com.furniro.store.presentation.store.response.StoreConfigResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class StoreConfigMapper {

    public UpdateStoreConfigCommand toUpdateStoreConfigCommand(UpdateStoreConfigRequest request) {
        return UpdateStoreConfigCommand.builder()
                .storeName(request.getStoreName())
                .defaultCurrency(request.getDefaultCurrency())
                .defaultLanguage(request.getDefaultLanguage())
                .currencies(mapOrNull(request.getCurrencies(), c -> UpdateStoreConfigCommand.CurrencyCommand.builder()
                        .code(c.getCode())
                        .symbol(c.getSymbol())
                        .name(c.getName())
                        .exchangeRate(c.getExchangeRate())
                        .isDefault(c.getIsDefault())
                        .isActive(c.getIsActive())
                        .build()))
                .languages(mapOrNull(request.getLanguages(), l -> UpdateStoreConfigCommand.LanguageCommand.builder()
                        .code(l.getCode())
                        .name(l.getName())
                        .isDefault(l.getIsDefault())
                        .isActive(l.getIsActive())
                        .build()))
                .shippingMethods(mapOrNull(request.getShippingMethods(), s -> UpdateStoreConfigCommand.ShippingMethodCommand.builder()
                        .id(s.getId())
                        .name(s.getName())
                        .cost(s.getCost())
                        .isActive(s.getIsActive())
                        .build()))
                .build();
    }

    public StoreConfigResponse toStoreConfigResponse(StoreConfigResult result) {
        return StoreConfigResponse.builder()
                .storeName(result.getStoreName())
                .defaultCurrency(result.getDefaultCurrency())
                .defaultLanguage(result.getDefaultLanguage())
                .currencies(mapOrNull(result.getCurrencies(), c -> StoreConfigResponse.CurrencyResponse.builder()
                        .code(c.getCode())
                        .symbol(c.getSymbol())
                        .name(c.getName())
                        .exchangeRate(c.getExchangeRate())
                        .isDefault(c.isDefault())
                        .isActive(c.isActive())
                        .build()))
                .languages(mapOrNull(result.getLanguages(), l -> StoreConfigResponse.LanguageResponse.builder()
                        .code(l.getCode())
                        .name(l.getName())
                        .isDefault(l.isDefault())
                        .isActive(l.isActive())
                        .build()))
                .shippingMethods(mapOrNull(result.getShippingMethods(), s -> StoreConfigResponse.ShippingMethodResponse.builder()
                        .id(s.getId())
                        .name(s.getName())
                        .cost(s.getCost())
                        .isActive(s.isActive())
                        .build()))
                .build();
    }

    // null 목록은 "변경 없음"이므로 그대로 null 유지
    private <S, T> List<T> mapOrNull(List<S> source, Function<S, T> mapper) {
        if (source == null) {
            return null;
        }
        return source.stream().map(mapper).collect(Collectors.toList());
    }
}
