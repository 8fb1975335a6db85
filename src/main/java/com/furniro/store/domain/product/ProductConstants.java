package com.furniro.store.domain.product;

/**
 * ProductConstants - 상품 도메인 상수
 */
public class ProductConstants {

    /** 최소 할인율 */
    public static final int MIN_SALE = 0;

    /** 최대 할인율 */
    public static final int MAX_SALE = 100;

    public static final String MSG_INVALID_SALE = String.format("할인율은 %d~%d 범위여야 합니다", MIN_SALE, MAX_SALE);
    public static final String MSG_NAME_REQUIRED = "상품명은 필수입니다";
    public static final String MSG_INVALID_PRICE = "가격은 0 이상이어야 합니다";
    public static final String MSG_COLORS_REQUIRED = "색상은 최소 1개 이상 필요합니다";

    private ProductConstants() {
        throw new AssertionError("ProductConstants는 인스턴스화할 수 없습니다");
    }
}
