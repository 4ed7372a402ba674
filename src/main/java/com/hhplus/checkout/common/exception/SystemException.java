package com.hhplus.checkout.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 사용 예:
 * - PaymentGatewayUnavailableException: 결제 게이트웨이 전송 오류 (최종 시도)
 *
 * 특징:
 * - 항상 서버 오류(5XX)로 응답
 * - 결과가 불확실하므로 모니터링/수동 확인 대상
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
