package com.furniro.store.application.order;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 주문 번호 생성기
 *
 * 형식: ORD-yyyyMMdd-XXXXXXXX (X: 대문자 16진수 8자리)
 */
@Component
public class OrderNumberGenerator {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    public String generate() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
        return "ORD-" + LocalDate.now().format(DATE_FORMAT) + "-" + suffix;
    }
}
