package com.furniro.store.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 사용 예:
 * - 담기: quantity < MIN_ADD_QUANTITY 이면 예외
 * - 수정: quantity < MIN_UPDATE_QUANTITY 이면 예외, 0이면 항목 제거
 */
public class CartConstants {

    /** 담기 최소 수량 */
    public static final int MIN_ADD_QUANTITY = 1;

    /** 수정 최소 수량 (0 = 항목 제거) */
    public static final int MIN_UPDATE_QUANTITY = 0;

    public static final String MSG_INVALID_ADD_QUANTITY = String.format("담기 수량은 %d 이상이어야 합니다", MIN_ADD_QUANTITY);
    public static final String MSG_INVALID_UPDATE_QUANTITY = String.format("수정 수량은 %d 이상이어야 합니다", MIN_UPDATE_QUANTITY);

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
