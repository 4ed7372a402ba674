package com.hhplus.checkout.presentation.payment.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 응답 DTO
 * data: InvoiceResponse(bank) 또는 ReceiptResponse(terminal/card), 실패 시 생략
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentResponse {

    private boolean success;

    private String method;

    private String message;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("transaction_id")
    private Long transactionId;

    private Object data;
}
