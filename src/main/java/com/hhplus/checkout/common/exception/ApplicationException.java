package com.hhplus.checkout.common.exception;

/**
 * ApplicationException - 애플리케이션 계층 프로세스 실패 예외
 *
 * DomainException과의 차이:
 * - DomainException: 도메인 규칙 자체의 위반 (예: 빈 장바구니)
 * - ApplicationException: 규칙은 만족하지만 처리 흐름이 실패 (예: 동시 결제 충돌)
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
}
