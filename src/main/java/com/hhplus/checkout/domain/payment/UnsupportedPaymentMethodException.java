package com.hhplus.checkout.domain.payment;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 지원하지 않거나 비활성화된 결제 수단 (400 Bad Request)
 */
public class UnsupportedPaymentMethodException extends DomainException {

    public UnsupportedPaymentMethodException(String method) {
        super(ErrorCode.UNSUPPORTED_PAYMENT_METHOD, "method=" + method);
    }
}
