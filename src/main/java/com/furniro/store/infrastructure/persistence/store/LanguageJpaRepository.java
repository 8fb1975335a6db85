package com.furniro.store.infrastructure.persistence.store;

import com.furniro.store.domain.store.Language;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LanguageJpaRepository extends JpaRepository<Language, Long> {
}
