package com.hhplus.checkout.domain.payment;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 결제 트랜잭션을 찾을 수 없을 때 발생하는 예외
 */
public class TransactionNotFoundException extends DomainException {

    public TransactionNotFoundException(Long transactionId) {
        super(ErrorCode.TRANSACTION_NOT_FOUND, "transactionId=" + transactionId);
    }
}
