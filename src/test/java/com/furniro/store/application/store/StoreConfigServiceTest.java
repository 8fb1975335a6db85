package com.furniro.store.application.store;

import com.furniro.store.application.store.dto.StoreConfigResult;
import com.furniro.store.application.store.dto.UpdateStoreConfigCommand;
import com.furniro.store.application.store.dto.UpdateStoreConfigCommand.CurrencyCommand;
import com.furniro.store.application.store.dto.UpdateStoreConfigCommand.LanguageCommand;
import com.furniro.store.application.store.dto.UpdateStoreConfigCommand.ShippingMethodCommand;
import com.furniro.store.common.exception.ApplicationException;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.domain.store.Currency;
import com.furniro.store.domain.store.Language;
import com.furniro.store.domain.store.ShippingMethod;
import com.furniro.store.infrastructure.persistence.store.InMemoryStoreConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StoreConfigServiceTest - Application 계층 단위 테스트
 *
 * 테스트 대상: StoreConfigService
 * - 저장된 설정이 없을 때 기본값
 * - 통화/언어 code 기준 upsert와 소프트 삭제
 * - 배송 방법 id 기준 upsert와 소프트 삭제
 */
@DisplayName("StoreConfigService 단위 테스트")
class StoreConfigServiceTest {

    private InMemoryStoreConfigRepository storeConfigRepository;
    private StoreConfigService storeConfigService;

    @BeforeEach
    void setup() {
        storeConfigRepository = new InMemoryStoreConfigRepository();
        storeConfigService = new StoreConfigService(storeConfigRepository, new StoreProperties());
    }

    @Test
    @DisplayName("조회 - 저장된 설정이 없으면 기본 통화/언어")
    void testGetConfig_Defaults() {
        StoreConfigResult result = storeConfigService.getConfig();

        assertEquals("USD", result.getDefaultCurrency());
        assertEquals("en", result.getDefaultLanguage());
        assertNull(result.getStoreName());
        assertTrue(result.getCurrencies().isEmpty());
    }

    // ========== 통화 / 언어 ==========

    @Test
    @DisplayName("통화 - code 기준 수정, 신규 생성, 요청에 없는 통화는 소프트 삭제")
    void testUpdateConfig_Currencies() {
        // Given
        storeConfigRepository.saveCurrency(Currency.createCurrency("USD", "$", "US Dollar", BigDecimal.ONE, true, true));
        storeConfigRepository.saveCurrency(Currency.createCurrency("EUR", "€", "Euro", new BigDecimal("0.92"), false, true));

        // When
        StoreConfigResult result = storeConfigService.updateConfig(UpdateStoreConfigCommand.builder()
                .storeName("Furniro")
                .currencies(List.of(
                        CurrencyCommand.builder().code("USD").symbol("$").name("Dollar").isDefault(true).build(),
                        CurrencyCommand.builder().code("KRW").symbol("₩").name("Won")
                                .exchangeRate(new BigDecimal("1350")).build()))
                .build());

        // Then
        assertEquals("Furniro", result.getStoreName());
        List<String> codes = result.getCurrencies().stream()
                .map(StoreConfigResult.CurrencyResult::getCode)
                .collect(Collectors.toList());
        assertEquals(List.of("USD", "KRW"), codes);
        assertEquals("Dollar", result.getCurrencies().get(0).getName());

        Currency euro = storeConfigRepository.findAllCurrencies().stream()
                .filter(c -> c.getCode().equals("EUR")).findFirst().orElseThrow();
        assertNotNull(euro.getDeletedAt());
        assertFalse(euro.isActive());
    }

    @Test
    @DisplayName("통화 - 소프트 삭제된 통화를 다시 보내면 복구")
    void testUpdateConfig_RestoreCurrency() {
        Currency euro = Currency.createCurrency("EUR", "€", "Euro", new BigDecimal("0.92"), false, true);
        storeConfigRepository.saveCurrency(euro);
        storeConfigService.updateConfig(UpdateStoreConfigCommand.builder().currencies(List.of()).build());
        assertFalse(euro.isVisible());

        StoreConfigResult result = storeConfigService.updateConfig(UpdateStoreConfigCommand.builder()
                .currencies(List.of(CurrencyCommand.builder().code("EUR").symbol("€").name("Euro").build()))
                .build());

        assertTrue(euro.isVisible());
        assertEquals(1, result.getCurrencies().size());
    }

    @Test
    @DisplayName("언어 - 목록이 없으면 기존 언어를 변경하지 않음")
    void testUpdateConfig_NullListUntouched() {
        storeConfigRepository.saveLanguage(Language.createLanguage("en", "English", true, true));
        storeConfigRepository.saveLanguage(Language.createLanguage("ko", "한국어", false, true));

        StoreConfigResult result = storeConfigService.updateConfig(UpdateStoreConfigCommand.builder()
                .defaultLanguage("ko")
                .build());

        assertEquals("ko", result.getDefaultLanguage());
        assertEquals(2, result.getLanguages().size());
    }

    @Test
    @DisplayName("언어 - code 누락은 INVALID_REQUEST")
    void testUpdateConfig_MissingCode() {
        ApplicationException e = assertThrows(ApplicationException.class, () -> storeConfigService.updateConfig(
                UpdateStoreConfigCommand.builder()
                        .languages(List.of(LanguageCommand.builder().name("English").build()))
                        .build()));
        assertEquals(ErrorCode.INVALID_REQUEST, e.getErrorCode());
    }

    // ========== 배송 방법 ==========

    @Test
    @DisplayName("배송 방법 - id가 있으면 수정, 없으면 생성, 나머지는 소프트 삭제")
    void testUpdateConfig_ShippingMethods() {
        // Given
        ShippingMethod standard = storeConfigRepository.saveShippingMethod(
                ShippingMethod.createShippingMethod("Standard", new BigDecimal("5.00"), true));
        ShippingMethod express = storeConfigRepository.saveShippingMethod(
                ShippingMethod.createShippingMethod("Express", new BigDecimal("15.00"), true));

        // When
        StoreConfigResult result = storeConfigService.updateConfig(UpdateStoreConfigCommand.builder()
                .shippingMethods(List.of(
                        ShippingMethodCommand.builder().id(standard.getShippingMethodId()).cost(new BigDecimal("7.00")).build(),
                        ShippingMethodCommand.builder().name("Pickup").build()))
                .build());

        // Then
        assertEquals(2, result.getShippingMethods().size());
        assertEquals("Standard", result.getShippingMethods().get(0).getName());
        assertEquals(new BigDecimal("7.00"), result.getShippingMethods().get(0).getCost());
        assertEquals("Pickup", result.getShippingMethods().get(1).getName());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getShippingMethods().get(1).getCost()));
        assertFalse(express.isVisible());
    }

    @Test
    @DisplayName("배송 방법 - 존재하지 않는 id는 새로 생성")
    void testUpdateConfig_UnknownShippingMethodId() {
        StoreConfigResult result = storeConfigService.updateConfig(UpdateStoreConfigCommand.builder()
                .shippingMethods(List.of(ShippingMethodCommand.builder().id(99L).name("Freight").build()))
                .build());

        assertEquals(1, result.getShippingMethods().size());
        assertEquals("Freight", result.getShippingMethods().get(0).getName());
        assertNotEquals(99L, result.getShippingMethods().get(0).getId());
    }

    @Test
    @DisplayName("배송 방법 - 이름 없는 신규 항목은 INVALID_REQUEST")
    void testUpdateConfig_ShippingMethodWithoutName() {
        assertThrows(ApplicationException.class, () -> storeConfigService.updateConfig(UpdateStoreConfigCommand.builder()
                .shippingMethods(List.of(ShippingMethodCommand.builder().cost(BigDecimal.ONE).build()))
                .build()));
    }
}
