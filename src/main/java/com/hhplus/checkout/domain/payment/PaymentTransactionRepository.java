package com.hhplus.checkout.domain.payment;

import java.util.List;
import java.util.Optional;

/**
 * PaymentTransaction Repository Interface (Port) - 결제 원장
 */
public interface PaymentTransactionRepository {

    PaymentTransaction save(PaymentTransaction transaction);

    Optional<PaymentTransaction> findById(Long transactionId);

    /**
     * 주문의 결제 시도 목록 (오래된 순)
     */
    List<PaymentTransaction> findByOrderId(Long orderId);
}
