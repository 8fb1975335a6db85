package com.furniro.store.infrastructure.persistence.store;

import com.furniro.store.domain.store.StoreSettings;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface StoreSettingsJpaRepository extends JpaRepository<StoreSettings, Long> {
    Optional<StoreSettings> findFirstByOrderBySettingsIdAsc();
}
