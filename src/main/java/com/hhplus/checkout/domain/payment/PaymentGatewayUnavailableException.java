package com.hhplus.checkout.domain.payment;

import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.SystemException;

/**
 * 마지막 게이트웨이 호출이 전송 오류로 끝났을 때 발생하는 예외 (503)
 *
 * 게이트웨이가 실제로 결제를 처리했는지 알 수 없으므로 주문은 CHECKOUT,
 * 원장 행은 PROCESSING 으로 남겨 수동 확인 대상으로 둔다.
 */
public class PaymentGatewayUnavailableException extends SystemException {

    private final Long orderId;
    private final Long transactionId;

    public PaymentGatewayUnavailableException(Long orderId, Long transactionId, Throwable cause) {
        super(ErrorCode.PAYMENT_GATEWAY_UNAVAILABLE, "orderId=" + orderId + ", transactionId=" + transactionId, cause);
        this.orderId = orderId;
        this.transactionId = transactionId;
    }

    public Long getOrderId() {
        return orderId;
    }

    public Long getTransactionId() {
        return transactionId;
    }
}
