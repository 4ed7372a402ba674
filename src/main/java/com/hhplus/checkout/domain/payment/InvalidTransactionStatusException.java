package com.hhplus.checkout.domain.payment;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 종결된 결제 트랜잭션을 변경하려 할 때 발생하는 예외
 */
public class InvalidTransactionStatusException extends DomainException {

    public InvalidTransactionStatusException(Long transactionId, PaymentStatus status) {
        super(ErrorCode.INVALID_TRANSACTION_STATUS, "transactionId=" + transactionId + ", status=" + status);
    }
}
