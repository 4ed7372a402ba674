package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.common.exception.ApplicationException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 장바구니가 동시에 생성/변경되었을 때 발생하는 예외 (409 Conflict)
 */
public class CartConflictException extends ApplicationException {

    public CartConflictException(Long customerId, Throwable cause) {
        super(ErrorCode.CART_CONFLICT, cause);
    }
}
