package com.hhplus.checkout.common.exception;

/**
 * BizException - 비즈니스 예외의 최상위 클래스
 *
 * 예외 계층:
 * BizException (최상위)
 * ├─ DomainException (도메인 규칙 위반, 4XX)
 * ├─ ApplicationException (프로세스 실패, 5XX)
 * └─ SystemException (인프라/외부 시스템 오류, 5XX)
 *
 * GlobalExceptionHandler는 ErrorCode의 HTTP 상태 코드로 응답을 만든다.
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BizException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage) {
        super(errorCode.getMessage() + " | " + detailMessage);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode.getMessage() + " | " + detailMessage, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public String getErrorCodeValue() {
        return errorCode.getCode();
    }
}
