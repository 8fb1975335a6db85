package com.furniro.store.domain.product;

/**
 * 상품 목록 정렬 기준
 * - NAME: 상품명
 * - DATE: 등록일
 * - PRICE: 실 판매가
 */
public enum ProductSortType {
    NAME,
    DATE,
    PRICE;

    /**
     * 문자열에서 정렬 기준으로 변환 (알 수 없는 값이면 DATE)
     */
    public static ProductSortType fromString(String value) {
        if (value == null) {
            return DATE;
        }
        for (ProductSortType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return DATE;
    }
}
