package com.furniro.store.application.store;

import com.furniro.store.application.store.dto.StoreConfigResult;
import com.furniro.store.application.store.dto.UpdateStoreConfigCommand;
import com.furniro.store.application.store.dto.UpdateStoreConfigCommand.CurrencyCommand;
import com.furniro.store.application.store.dto.UpdateStoreConfigCommand.LanguageCommand;
import com.furniro.store.application.store.dto.UpdateStoreConfigCommand.ShippingMethodCommand;
import com.furniro.store.common.exception.ApplicationException;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.domain.store.*;
import com.furniro.store.domain.store.Currency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * StoreConfigService - 스토어 설정 관리 (Application 계층)
 *
 * 수정 규칙:
 * - 통화/언어: code 기준 upsert, 요청에 없는 기존 항목은 소프트 삭제
 * - 배송 방법: id가 있으면 수정, 없으면 생성. 요청에 없고 이번에 생성되지도 않은 활성 항목은 소프트 삭제
 * - 요청에 목록 자체가 없으면 해당 목록은 변경하지 않음
 */
@Slf4j
@Service
public class StoreConfigService {

    private final StoreConfigRepository storeConfigRepository;
    private final StoreProperties storeProperties;

    public StoreConfigService(StoreConfigRepository storeConfigRepository, StoreProperties storeProperties) {
        this.storeConfigRepository = storeConfigRepository;
        this.storeProperties = storeProperties;
    }

    /**
     * 스토어 설정 조회 (저장된 설정이 없으면 기본값)
     */
    @Transactional(readOnly = true)
    public StoreConfigResult getConfig() {
        StoreSettings settings = storeConfigRepository.findSettings()
                .orElseGet(() -> StoreSettings.defaults(storeProperties.getDefaultCurrency(), storeProperties.getDefaultLanguage()));
        return toResult(settings);
    }

    @Transactional
    public StoreConfigResult updateConfig(UpdateStoreConfigCommand command) {
        LocalDateTime now = LocalDateTime.now();

        StoreSettings settings = storeConfigRepository.findSettings()
                .orElseGet(() -> StoreSettings.defaults(storeProperties.getDefaultCurrency(), storeProperties.getDefaultLanguage()));
        settings.update(command.getStoreName(), command.getDefaultCurrency(), command.getDefaultLanguage());
        StoreSettings saved = storeConfigRepository.saveSettings(settings);

        if (command.getCurrencies() != null) {
            upsertCurrencies(command.getCurrencies(), now);
        }
        if (command.getLanguages() != null) {
            upsertLanguages(command.getLanguages(), now);
        }
        if (command.getShippingMethods() != null) {
            upsertShippingMethods(command.getShippingMethods(), now);
        }

        log.info("스토어 설정 수정: storeName={}, currencies={}, languages={}, shippingMethods={}",
                saved.getStoreName(),
                sizeOf(command.getCurrencies()), sizeOf(command.getLanguages()), sizeOf(command.getShippingMethods()));
        return toResult(saved);
    }

    private void upsertCurrencies(List<CurrencyCommand> commands, LocalDateTime now) {
        Map<String, Currency> existing = storeConfigRepository.findAllCurrencies().stream()
                .collect(Collectors.toMap(Currency::getCode, Function.identity()));
        Set<String> received = new HashSet<>();

        for (CurrencyCommand command : commands) {
            requireCode(command.getCode());
            received.add(command.getCode());
            Currency currency = existing.get(command.getCode());
            if (currency == null) {
                currency = Currency.createCurrency(command.getCode(), command.getSymbol(), command.getName(),
                        command.getExchangeRate(), isTrue(command.getIsDefault()), activeOrDefault(command.getIsActive()));
            } else {
                currency.update(command.getSymbol(), command.getName(), command.getExchangeRate(),
                        isTrue(command.getIsDefault()), activeOrDefault(command.getIsActive()));
            }
            storeConfigRepository.saveCurrency(currency);
        }

        existing.values().stream()
                .filter(c -> !received.contains(c.getCode()) && c.getDeletedAt() == null)
                .forEach(c -> {
                    c.softDelete(now);
                    storeConfigRepository.saveCurrency(c);
                });
    }

    private void upsertLanguages(List<LanguageCommand> commands, LocalDateTime now) {
        Map<String, Language> existing = storeConfigRepository.findAllLanguages().stream()
                .collect(Collectors.toMap(Language::getCode, Function.identity()));
        Set<String> received = new HashSet<>();

        for (LanguageCommand command : commands) {
            requireCode(command.getCode());
            received.add(command.getCode());
            Language language = existing.get(command.getCode());
            if (language == null) {
                language = Language.createLanguage(command.getCode(), command.getName(),
                        isTrue(command.getIsDefault()), activeOrDefault(command.getIsActive()));
            } else {
                language.update(command.getName(), isTrue(command.getIsDefault()), activeOrDefault(command.getIsActive()));
            }
            storeConfigRepository.saveLanguage(language);
        }

        existing.values().stream()
                .filter(l -> !received.contains(l.getCode()) && l.getDeletedAt() == null)
                .forEach(l -> {
                    l.softDelete(now);
                    storeConfigRepository.saveLanguage(l);
                });
    }

    private void upsertShippingMethods(List<ShippingMethodCommand> commands, LocalDateTime now) {
        Set<Long> keptIds = new HashSet<>();

        for (ShippingMethodCommand command : commands) {
            if (command.getId() != null) {
                Optional<ShippingMethod> found = storeConfigRepository.findShippingMethodById(command.getId());
                if (found.isPresent()) {
                    ShippingMethod method = found.get();
                    method.update(command.getName(), command.getCost(), activeOrDefault(command.getIsActive()));
                    keptIds.add(storeConfigRepository.saveShippingMethod(method).getShippingMethodId());
                    continue;
                }
            }
            if (command.getName() == null || command.getName().isBlank()) {
                throw new ApplicationException(ErrorCode.INVALID_REQUEST, "배송 방법 이름은 필수입니다");
            }
            ShippingMethod created = storeConfigRepository.saveShippingMethod(
                    ShippingMethod.createShippingMethod(command.getName(), command.getCost(), activeOrDefault(command.getIsActive())));
            keptIds.add(created.getShippingMethodId());
        }

        storeConfigRepository.findAllShippingMethods().stream()
                .filter(m -> m.isVisible() && !keptIds.contains(m.getShippingMethodId()))
                .forEach(m -> {
                    m.softDelete(now);
                    storeConfigRepository.saveShippingMethod(m);
                });
    }

    private StoreConfigResult toResult(StoreSettings settings) {
        return StoreConfigResult.of(settings,
                storeConfigRepository.findAllCurrencies().stream().filter(Currency::isVisible).collect(Collectors.toList()),
                storeConfigRepository.findAllLanguages().stream().filter(Language::isVisible).collect(Collectors.toList()),
                storeConfigRepository.findAllShippingMethods().stream().filter(ShippingMethod::isVisible).collect(Collectors.toList()));
    }

    private void requireCode(String code) {
        if (code == null || code.isBlank()) {
            throw new ApplicationException(ErrorCode.INVALID_REQUEST, "code는 필수입니다");
        }
    }

    private boolean isTrue(Boolean value) {
        return Boolean.TRUE.equals(value);
    }

    private boolean activeOrDefault(Boolean value) {
        return value == null || value;
    }

    private String sizeOf(List<?> list) {
        return list == null ? "유지" : String.valueOf(list.size());
    }
}
