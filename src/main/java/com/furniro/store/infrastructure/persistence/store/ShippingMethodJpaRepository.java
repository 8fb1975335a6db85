package com.furniro.store.infrastructure.persistence.store;

import com.furniro.store.domain.store.ShippingMethod;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ShippingMethodJpaRepository extends JpaRepository<ShippingMethod, Long> {
}
