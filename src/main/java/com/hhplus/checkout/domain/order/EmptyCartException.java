package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 결제할 장바구니가 없거나 비어 있을 때 발생하는 예외 (400 Bad Request)
 *
 * - noActiveCart: 고객의 OPEN 주문이 없음
 * - cartIsEmpty: OPEN 주문에 항목이 없음
 */
public class EmptyCartException extends DomainException {

    private EmptyCartException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public static EmptyCartException noActiveCart(Long customerId) {
        return new EmptyCartException(ErrorCode.NO_ACTIVE_CART, "customerId=" + customerId);
    }

    public static EmptyCartException cartIsEmpty(Long orderId) {
        return new EmptyCartException(ErrorCode.CART_EMPTY, "orderId=" + orderId);
    }
}
