package com.furniro.store.domain.store;

import java.util.List;
import java.util.Optional;

/**
 * StoreConfigRepository - 스토어 설정 영속성 Port Interface
 *
 * 설정, 통화, 언어, 배송 방법은 항상 함께 조회/수정되므로 하나의 Port로 묶습니다.
 */
public interface StoreConfigRepository {

    Optional<StoreSettings> findSettings();

    StoreSettings saveSettings(StoreSettings settings);

    /**
     * 전체 통화 조회 (소프트 삭제 포함)
     */
    List<Currency> findAllCurrencies();

    Currency saveCurrency(Currency currency);

    /**
     * 전체 언어 조회 (소프트 삭제 포함)
     */
    List<Language> findAllLanguages();

    Language saveLanguage(Language language);

    /**
     * 전체 배송 방법 조회 (소프트 삭제 포함)
     */
    List<ShippingMethod> findAllShippingMethods();

    Optional<ShippingMethod> findShippingMethodById(Long shippingMethodId);

    ShippingMethod saveShippingMethod(ShippingMethod shippingMethod);
}
