package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.PaymentTransaction;
import com.hhplus.checkout.domain.payment.PaymentTransactionRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemoryPaymentTransactionRepository - 결제 원장 저장소 (인메모리, 테스트용)
 */
public class InMemoryPaymentTransactionRepository implements PaymentTransactionRepository {

    private final ConcurrentHashMap<Long, PaymentTransaction> transactions = new ConcurrentHashMap<>();
    private final AtomicLong transactionIdSequence = new AtomicLong(9000L);

    @Override
    public PaymentTransaction save(PaymentTransaction transaction) {
        if (transaction.getTransactionId() != null) {
            transactions.put(transaction.getTransactionId(), transaction);
            return transaction;
        }
        PaymentTransaction saved = PaymentTransaction.builder()
                .transactionId(transactionIdSequence.incrementAndGet())
                .orderId(transaction.getOrderId())
                .customerId(transaction.getCustomerId())
                .paymentMethod(transaction.getPaymentMethod())
                .amount(transaction.getAmount())
                .status(transaction.getStatus())
                .idempotencyKey(transaction.getIdempotencyKey())
                .externalTransactionId(transaction.getExternalTransactionId())
                .errorMessage(transaction.getErrorMessage())
                .createdAt(transaction.getCreatedAt())
                .processedAt(transaction.getProcessedAt())
                .build();
        transactions.put(saved.getTransactionId(), saved);
        return saved;
    }

    @Override
    public Optional<PaymentTransaction> findById(Long transactionId) {
        return Optional.ofNullable(transactions.get(transactionId));
    }

    @Override
    public List<PaymentTransaction> findByOrderId(Long orderId) {
        return transactions.values().stream()
                .filter(transaction -> transaction.getOrderId().equals(orderId))
                .sorted(Comparator.comparing(PaymentTransaction::getTransactionId))
                .collect(Collectors.toList());
    }

    /**
     * 테스트용: 전체 원장 조회
     */
    public List<PaymentTransaction> findAll() {
        return new ArrayList<>(transactions.values());
    }
}
