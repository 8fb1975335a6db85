package com.furniro.store.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * StoreProperties - application.yml의 furniro.store.* 설정 바인딩
 *
 * 설정 항목:
 * - default-page-size: limit 파라미터가 없을 때 사용하는 페이지 크기
 * - max-page-size: 허용하는 최대 페이지 크기
 * - default-currency / default-language: 스토어 설정이 아직 저장되지 않았을 때의 기본값
 * - low-stock-warn-threshold: 주문 후 색상 재고가 이 값 미만이면 WARN 로그
 */
@Component
@ConfigurationProperties(prefix = "furniro.store")
@Getter
@Setter
public class StoreProperties {

    private int defaultPageSize = 16;

    private int maxPageSize = 100;

    private String defaultCurrency = "USD";

    private String defaultLanguage = "en";

    private int lowStockWarnThreshold = 5;
}
