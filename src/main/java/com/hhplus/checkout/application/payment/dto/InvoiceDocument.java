package com.hhplus.checkout.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 은행 송금 결과 - 발행된 인보이스
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceDocument {
    private String fileName;
    private byte[] content;
    private Long customerId;
    private Long orderId;
    private BigDecimal amount;
    private LocalDateTime createdAt;
    private LocalDateTime validUntil;
}
