package com.hhplus.checkout.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 처리 결과 (Application layer 내부 DTO)
 *
 * data:
 * - bank: InvoiceDocument
 * - terminal/card 성공: PaymentReceipt
 * - 실패: null
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResult {
    private boolean success;
    private String method;
    private String message;
    private Long orderId;
    private Long transactionId;
    private Object data;
}
