package com.hhplus.checkout.domain.customer;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 고객을 찾을 수 없을 때 발생하는 예외 (404 Not Found)
 */
public class CustomerNotFoundException extends DomainException {

    public CustomerNotFoundException(Long customerId) {
        super(ErrorCode.CUSTOMER_NOT_FOUND, "customerId=" + customerId);
    }
}
