package com.furniro.store.infrastructure.persistence.store;

import com.furniro.store.domain.store.Currency;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CurrencyJpaRepository extends JpaRepository<Currency, Long> {
}
