package com.furniro.store.domain.product;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 색상별 재고가 요청 수량보다 적을 때 발생하는 예외
 *
 * 메시지 예: "재고가 부족합니다 | 소파(Grey) 재고 부족 - 보유: 1, 요청: 3"
 */
@Getter
public class InsufficientStockException extends DomainException {

    private final String productName;
    private final int available;
    private final int requested;

    public InsufficientStockException(String productName, String colorName, int available, int requested) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("%s(%s) 재고 부족 - 보유: %d, 요청: %d", productName, colorName, available, requested));
        this.productName = productName;
        this.available = available;
        this.requested = requested;
    }
}
