package com.hhplus.checkout.application.payment.strategy;

import com.hhplus.checkout.application.payment.dto.PaymentCommand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 결제 수단 전략에 전달되는 결제 시도 정보
 */
@Getter
@Builder
@AllArgsConstructor
public class PaymentContext {
    private final Long customerId;
    private final Long orderId;
    private final Long transactionId;
    private final BigDecimal amount;
    private final String idempotencyKey;
    private final LocalDateTime startedAt;
    private final PaymentCommand command;
}
