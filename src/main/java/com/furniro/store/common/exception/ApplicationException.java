package com.furniro.store.common.exception;

/**
 * ApplicationException - 애플리케이션 계층 요청 처리 실패 예외
 *
 * 역할:
 * - 도메인 규칙과 무관한 요청 조건 오류 (페이지 파라미터, 금액 범위 등)
 * - 프로세스 실패 (주문 생성 실패 등)
 *
 * DomainException과의 차이:
 * - DomainException: 도메인 규칙 자체의 위반 (예: 재고 부족)
 * - ApplicationException: 규칙은 만족하지만 요청/프로세스가 실패 (예: 잘못된 조회 조건)
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
