package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 수량이 유효하지 않을 때 발생하는 예외
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(int quantity) {
        super(ErrorCode.INVALID_QUANTITY, "quantity=" + quantity);
    }
}
