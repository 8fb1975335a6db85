package com.furniro.store.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 * - 일관된 에러 응답 제공
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_CART_EMPTY, APP_ORDER_CREATION_FAILED
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // User Domain
    USER_NOT_FOUND("DOMAIN_USER_NOT_FOUND", "사용자를 찾을 수 없습니다", 404),
    USER_EMAIL_DUPLICATE("DOMAIN_USER_EMAIL_DUPLICATE", "이미 사용 중인 이메일입니다", 400),
    USER_INVALID_PROFILE("DOMAIN_USER_INVALID_PROFILE", "이름과 성은 필수입니다", 400),
    USER_INVALID_ROLE("DOMAIN_USER_INVALID_ROLE", "유효하지 않은 사용자 역할입니다", 400),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    INVALID_PRODUCT("DOMAIN_PRODUCT_INVALID", "유효하지 않은 상품 정보입니다", 400),
    INVALID_COLOR("DOMAIN_PRODUCT_INVALID_COLOR", "유효하지 않은 색상입니다", 400),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 400),

    // Category Domain
    CATEGORY_NOT_FOUND("DOMAIN_CATEGORY_NOT_FOUND", "카테고리를 찾을 수 없습니다", 404),
    CATEGORY_DUPLICATE("DOMAIN_CATEGORY_DUPLICATE", "이미 존재하는 카테고리 이름입니다", 400),
    CATEGORY_INVALID_NAME("DOMAIN_CATEGORY_INVALID_NAME", "카테고리 이름은 필수입니다", 400),

    // Cart Domain
    CART_NOT_FOUND("DOMAIN_CART_NOT_FOUND", "장바구니를 찾을 수 없습니다", 404),
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "유효하지 않은 수량입니다", 400),
    CART_INVALID_ITEM("DOMAIN_CART_INVALID_ITEM", "유효하지 않은 장바구니 항목입니다", 400),
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),
    CART_CONFLICT("DOMAIN_CART_CONFLICT", "장바구니가 동시에 수정되었습니다. 다시 시도해 주세요", 409),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    INVALID_ORDER_STATUS("DOMAIN_ORDER_INVALID_STATUS", "유효하지 않은 주문 상태입니다", 400),
    USER_MISMATCH("DOMAIN_ORDER_USER_MISMATCH", "주문 사용자가 일치하지 않습니다", 403),

    // ========== Application Layer Errors ==========

    INVALID_REQUEST("APP_INVALID_REQUEST", "잘못된 요청입니다", 400),
    INVALID_PAGINATION("APP_INVALID_PAGINATION", "페이지 파라미터가 올바르지 않습니다", 400),
    INVALID_AMOUNT_RANGE("APP_INVALID_AMOUNT_RANGE", "최소 금액은 최대 금액보다 작아야 합니다", 400),
    NO_FIELDS_TO_UPDATE("APP_NO_FIELDS_TO_UPDATE", "수정할 항목이 없습니다", 400),
    ORDER_CREATION_FAILED("APP_ORDER_CREATION_FAILED", "주문 생성에 실패했습니다", 500),

    // ========== System Errors (5XX) ==========

    DATABASE_ERROR("SYSTEM_DATABASE_ERROR", "데이터베이스 오류가 발생했습니다", 500),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
