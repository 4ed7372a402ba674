package com.hhplus.checkout.presentation.payment.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 게이트웨이 결제 영수증 응답
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptResponse {

    @JsonProperty("customer_id")
    private Long customerId;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("payment_date")
    private LocalDateTime paymentDate;

    private BigDecimal amount;

    @JsonProperty("external_transaction_id")
    private String externalTransactionId;
}
