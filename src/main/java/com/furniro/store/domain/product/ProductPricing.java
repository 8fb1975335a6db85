package com.furniro.store.domain.product;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * ProductPricing - 상품 가격 계산 규칙
 *
 * 핵심 비즈니스 규칙:
 * - 실 판매가 = sale > 0 ? price × (1 − sale/100) : price
 * - 중간 계산(단가 × 수량, 합계 누적)은 반올림하지 않음
 * - 저장/표시 시점에만 소수점 2자리 HALF_UP 반올림
 *
 * 장바구니와 주문이 모두 이 클래스를 통해 가격을 계산합니다.
 */
public final class ProductPricing {

    public static final int PRICE_SCALE = 2;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private ProductPricing() {
        throw new AssertionError("ProductPricing은 인스턴스화할 수 없습니다");
    }

    /**
     * 할인율이 적용된 실 판매가 (반올림하지 않음)
     *
     * @param price 정가
     * @param sale 할인율 (0~100, null이면 0)
     */
    public static BigDecimal effectivePrice(BigDecimal price, Integer sale) {
        if (price == null) {
            throw new IllegalArgumentException("가격은 null일 수 없습니다");
        }
        if (sale == null || sale <= 0) {
            return price;
        }
        BigDecimal ratio = HUNDRED.subtract(BigDecimal.valueOf(sale));
        return price.multiply(ratio).divide(HUNDRED);
    }

    /**
     * 라인 소계 = 단가 × 수량 (반올림하지 않음)
     */
    public static BigDecimal lineTotal(BigDecimal unitPrice, int quantity) {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * 저장/표시용 반올림 (소수점 2자리, HALF_UP)
     */
    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
