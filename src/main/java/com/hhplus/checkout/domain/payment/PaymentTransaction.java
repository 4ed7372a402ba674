package com.hhplus.checkout.domain.payment;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * PaymentTransaction 엔티티 - 결제 원장(append-only)의 한 행
 *
 * 책임:
 * - 결제 시도 1회를 기록 (주문 금액 스냅샷 포함)
 * - 결제 결과에 따른 상태 전환
 *
 * 핵심 비즈니스 규칙:
 * - 결제 시도마다 새 행을 추가한다 (한 주문에 여러 행 가능)
 * - PENDING/PROCESSING → COMPLETED/FAILED 만 허용
 * - COMPLETED/FAILED 행은 다시 변경하지 않는다
 * - idempotencyKey 는 같은 시도의 모든 게이트웨이 재시도에 동일하게 전송된다
 */
@Entity
@Table(name = "payment_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_payment_tx_idempotency", columnNames = "idempotency_key"),
        indexes = @Index(name = "idx_payment_tx_order", columnList = "order_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransaction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "transaction_id")
    private Long transactionId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "payment_method", nullable = false, length = 30)
    private String paymentMethod;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private PaymentStatus status;

    @Column(name = "idempotency_key", nullable = false, length = 64)
    private String idempotencyKey;

    @Column(name = "external_transaction_id")
    private String externalTransactionId;

    @Column(name = "error_message", length = 500)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    /**
     * 결제 시도 시작 (정적 팩토리)
     * 은행 송금은 PENDING, 게이트웨이 결제는 PROCESSING 으로 시작한다.
     */
    public static PaymentTransaction start(Long orderId, Long customerId, PaymentMethodType method,
                                           BigDecimal amount, String idempotencyKey, LocalDateTime now) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("결제 금액은 0 이상이어야 합니다");
        }
        return PaymentTransaction.builder()
                .orderId(orderId)
                .customerId(customerId)
                .paymentMethod(method.getCode())
                .amount(amount)
                .status(method.getInitialStatus())
                .idempotencyKey(idempotencyKey)
                .createdAt(now)
                .build();
    }

    /**
     * 결제 성공 (PENDING/PROCESSING → COMPLETED)
     */
    public void complete(String externalTransactionId, LocalDateTime now) {
        assertNotTerminal();
        this.status = PaymentStatus.COMPLETED;
        this.externalTransactionId = externalTransactionId;
        this.processedAt = now;
    }

    /**
     * 결제 실패 (PENDING/PROCESSING → FAILED)
     */
    public void fail(String reason, LocalDateTime now) {
        assertNotTerminal();
        this.status = PaymentStatus.FAILED;
        this.errorMessage = truncate(reason);
        this.processedAt = now;
    }

    /**
     * 결과 불명 오류 기록 (상태는 유지, 수동 확인 대상)
     */
    public void recordError(String errorMessage) {
        assertNotTerminal();
        this.errorMessage = truncate(errorMessage);
    }

    private void assertNotTerminal() {
        if (this.status.isTerminal()) {
            throw new InvalidTransactionStatusException(this.transactionId, this.status);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 500) {
            return message;
        }
        return message.substring(0, 500);
    }
}
