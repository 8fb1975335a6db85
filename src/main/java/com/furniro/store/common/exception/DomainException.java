package com.furniro.store.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 비즈니스 도메인의 규칙 위반 시 발생
 * - 유효성 검증, 상태 값 오류, 리소스 부재 등
 * - 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - ProductNotFoundException: 상품 조회 실패
 * - InsufficientStockException: 색상별 재고 부족
 * - EmptyCartException: 빈 장바구니로 주문 시도
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
