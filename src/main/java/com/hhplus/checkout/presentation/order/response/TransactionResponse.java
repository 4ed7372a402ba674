package com.hhplus.checkout.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.order.dto.TransactionView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 결제 원장 행 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResponse {

    @JsonProperty("transaction_id")
    private Long transactionId;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("payment_method")
    private String paymentMethod;

    private BigDecimal amount;

    private String status;

    @JsonProperty("external_transaction_id")
    private String externalTransactionId;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("processed_at")
    private LocalDateTime processedAt;

    public static TransactionResponse from(TransactionView view) {
        return TransactionResponse.builder()
                .transactionId(view.getTransactionId())
                .orderId(view.getOrderId())
                .paymentMethod(view.getPaymentMethod())
                .amount(view.getAmount())
                .status(view.getStatus().name())
                .externalTransactionId(view.getExternalTransactionId())
                .errorMessage(view.getErrorMessage())
                .createdAt(view.getCreatedAt())
                .processedAt(view.getProcessedAt())
                .build();
    }
}
