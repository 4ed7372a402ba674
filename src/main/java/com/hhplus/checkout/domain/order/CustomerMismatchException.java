package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 다른 고객의 주문에 접근할 때 발생하는 예외 (403 Forbidden)
 */
public class CustomerMismatchException extends DomainException {

    public CustomerMismatchException(Long orderId, Long customerId) {
        super(ErrorCode.CUSTOMER_MISMATCH, "orderId=" + orderId + ", customerId=" + customerId);
    }
}
