package com.hhplus.checkout.domain.payment;

import lombok.*;

import java.math.BigDecimal;

/**
 * 단말기 결제 게이트웨이 요청 본문
 *
 * accountNumber 는 고객 ID, invoiceNumber 는 주문 ID
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TerminalPaymentRequest {
    private BigDecimal transactionAmount;
    private String accountNumber;
    private String invoiceNumber;
}
