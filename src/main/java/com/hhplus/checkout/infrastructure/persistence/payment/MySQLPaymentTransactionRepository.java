package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.PaymentTransaction;
import com.hhplus.checkout.domain.payment.PaymentTransactionRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 결제 원장 Repository 구현
 */
@Repository
public class MySQLPaymentTransactionRepository implements PaymentTransactionRepository {

    private final PaymentTransactionJpaRepository paymentTransactionJpaRepository;

    public MySQLPaymentTransactionRepository(PaymentTransactionJpaRepository paymentTransactionJpaRepository) {
        this.paymentTransactionJpaRepository = paymentTransactionJpaRepository;
    }

    @Override
    public PaymentTransaction save(PaymentTransaction transaction) {
        return paymentTransactionJpaRepository.save(transaction);
    }

    @Override
    public Optional<PaymentTransaction> findById(Long transactionId) {
        return paymentTransactionJpaRepository.findById(transactionId);
    }

    @Override
    public List<PaymentTransaction> findByOrderId(Long orderId) {
        return paymentTransactionJpaRepository.findByOrderIdOrderByTransactionIdAsc(orderId);
    }
}
