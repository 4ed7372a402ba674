package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * OPEN 상태가 아닌 주문의 항목을 변경하려 할 때 발생하는 예외
 */
public class OrderNotMutableException extends DomainException {

    public OrderNotMutableException(Long orderId, OrderStatus status) {
        super(ErrorCode.ORDER_NOT_MUTABLE, "orderId=" + orderId + ", status=" + status);
    }
}
