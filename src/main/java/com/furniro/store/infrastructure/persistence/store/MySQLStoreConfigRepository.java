package com.furniro.store.infrastructure.persistence.store;

import com.furniro.store.domain.store.Currency;
import com.furniro.store.domain.store.Language;
import com.furniro.store.domain.store.ShippingMethod;
import com.furniro.store.domain.store.StoreConfigRepository;
import com.furniro.store.domain.store.StoreSettings;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 StoreConfig Repository 구현
 *
 * 설정/통화/언어/배송 방법 각각의 JpaRepository를 하나의 Port로 묶습니다.
 */
@Repository
public class MySQLStoreConfigRepository implements StoreConfigRepository {

    private final StoreSettingsJpaRepository storeSettingsJpaRepository;
    private final CurrencyJpaRepository currencyJpaRepository;
    private final LanguageJpaRepository languageJpaRepository;
    private final ShippingMethodJpaRepository shippingMethodJpaRepository;

    public MySQLStoreConfigRepository(StoreSettingsJpaRepository storeSettingsJpaRepository,
                                      CurrencyJpaRepository currencyJpaRepository,
                                      LanguageJpaRepository languageJpaRepository,
                                      ShippingMethodJpaRepository shippingMethodJpaRepository) {
        this.storeSettingsJpaRepository = storeSettingsJpaRepository;
        this.currencyJpaRepository = currencyJpaRepository;
        this.languageJpaRepository = languageJpaRepository;
        this.shippingMethodJpaRepository = shippingMethodJpaRepository;
    }

    @Override
    public Optional<StoreSettings> findSettings() {
        return storeSettingsJpaRepository.findFirstByOrderBySettingsIdAsc();
    }

    @Override
    public StoreSettings saveSettings(StoreSettings settings) {
        return storeSettingsJpaRepository.save(settings);
    }

    @Override
    public List<Currency> findAllCurrencies() {
        return currencyJpaRepository.findAll();
    }

    @Override
    public Currency saveCurrency(Currency currency) {
        return currencyJpaRepository.save(currency);
    }

    @Override
    public List<Language> findAllLanguages() {
        return languageJpaRepository.findAll();
    }

    @Override
    public Language saveLanguage(Language language) {
        return languageJpaRepository.save(language);
    }

    @Override
    public List<ShippingMethod> findAllShippingMethods() {
        return shippingMethodJpaRepository.findAll();
    }

    @Override
    public Optional<ShippingMethod> findShippingMethodById(Long shippingMethodId) {
        return shippingMethodJpaRepository.findById(shippingMethodId);
    }

    @Override
    public ShippingMethod saveShippingMethod(ShippingMethod shippingMethod) {
        return shippingMethodJpaRepository.save(shippingMethod);
    }
}
