package com.hhplus.checkout.domain.payment;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 결제 수단별 필수 정보 누락 (400 Bad Request)
 */
public class InvalidPaymentRequestException extends DomainException {

    public InvalidPaymentRequestException(String detailMessage) {
        super(ErrorCode.INVALID_PAYMENT_REQUEST, detailMessage);
    }
}
