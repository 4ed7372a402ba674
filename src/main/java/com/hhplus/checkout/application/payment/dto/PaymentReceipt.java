package com.hhplus.checkout.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 게이트웨이 결제 성공 영수증
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentReceipt {
    private Long customerId;
    private Long orderId;
    private LocalDateTime paymentDate;
    private BigDecimal amount;
    private String externalTransactionId;
}
