package com.hhplus.checkout.application.payment.invoice;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 은행 송금 인보이스 입력값
 */
@Getter
@Builder
@AllArgsConstructor
public class BankInvoice {
    private final Long customerId;
    private final Long orderId;
    private final BigDecimal amount;
    private final LocalDateTime createdAt;
    private final LocalDateTime validUntil;

    public String getFileName() {
        return "invoice_" + orderId + ".txt";
    }
}
