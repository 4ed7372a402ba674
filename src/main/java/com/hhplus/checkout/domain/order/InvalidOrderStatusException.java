package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 전이 테이블에 없는 주문 상태 전이를 시도할 때 발생하는 예외 (400 Bad Request)
 */
public class InvalidOrderStatusException extends DomainException {

    public InvalidOrderStatusException(OrderStatus from, OrderEvent event) {
        super(ErrorCode.INVALID_ORDER_STATUS, "status=" + from + ", event=" + event);
    }
}
