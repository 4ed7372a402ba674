package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.common.exception.ApplicationException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 조건부 상태 전환이 0건에 적용되었을 때 발생하는 예외 (409 Conflict)
 *
 * 같은 장바구니에 대한 동시 결제 요청 중 늦은 쪽이 받는다.
 */
public class OrderConflictException extends ApplicationException {

    public OrderConflictException(Long orderId, OrderStatus expected) {
        super(ErrorCode.ORDER_CHECKOUT_CONFLICT, "orderId=" + orderId + ", expected=" + expected);
    }
}
