package com.furniro.store.infrastructure.config;

import com.furniro.store.domain.cart.CartPriceCalculator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * DomainServiceConfig - Domain Services를 Spring Bean으로 등록
 *
 * Domain Services는 순수 비즈니스 로직만 포함하므로 외부 의존성이 없습니다.
 * Spring Bean으로 등록하면 Application Services에서 주입받아 사용할 수 있습니다.
 */
@Configuration
public class DomainServiceConfig {

    @Bean
    public CartPriceCalculator cartPriceCalculator() {
        return new CartPriceCalculator();
    }
}
