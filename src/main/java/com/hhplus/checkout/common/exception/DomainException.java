package com.hhplus.checkout.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 사용 예:
 * - EmptyCartException: 활성 장바구니 없음 / 빈 장바구니
 * - InvalidOrderStatusException: 전이 테이블에 없는 주문 상태 전이
 * - CustomerNotFoundException: 고객 조회 실패
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
