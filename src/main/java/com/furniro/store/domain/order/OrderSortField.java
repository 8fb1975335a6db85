package com.furniro.store.domain.order;

/**
 * 관리자 주문 목록 정렬 기준
 */
public enum OrderSortField {
    CREATED_AT("createdAt"),
    TOTAL_AMOUNT("totalAmount"),
    ORDER_NUMBER("orderNumber");

    private final String property;

    OrderSortField(String property) {
        this.property = property;
    }

    public String getProperty() {
        return property;
    }

    /**
     * 요청 값(createdAt, totalAmount, orderNumber 또는 enum 이름)을 정렬 기준으로 변환
     * 알 수 없는 값이면 CREATED_AT
     */
    public static OrderSortField fromString(String value) {
        if (value == null || value.isBlank()) {
            return CREATED_AT;
        }
        for (OrderSortField field : values()) {
            if (field.property.equalsIgnoreCase(value) || field.name().equalsIgnoreCase(value)) {
                return field;
            }
        }
        return CREATED_AT;
    }
}
