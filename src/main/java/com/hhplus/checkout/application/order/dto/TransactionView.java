package com.hhplus.checkout.application.order.dto;

import com.hhplus.checkout.domain.payment.PaymentStatus;
import com.hhplus.checkout.domain.payment.PaymentTransaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 결제 원장 행 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionView {
    private Long transactionId;
    private Long orderId;
    private String paymentMethod;
    private BigDecimal amount;
    private PaymentStatus status;
    private String externalTransactionId;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime processedAt;

    public static TransactionView from(PaymentTransaction transaction) {
        return TransactionView.builder()
                .transactionId(transaction.getTransactionId())
                .orderId(transaction.getOrderId())
                .paymentMethod(transaction.getPaymentMethod())
                .amount(transaction.getAmount())
                .status(transaction.getStatus())
                .externalTransactionId(transaction.getExternalTransactionId())
                .errorMessage(transaction.getErrorMessage())
                .createdAt(transaction.getCreatedAt())
                .processedAt(transaction.getProcessedAt())
                .build();
    }
}
