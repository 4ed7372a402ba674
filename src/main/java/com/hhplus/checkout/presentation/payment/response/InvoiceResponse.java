package com.hhplus.checkout.presentation.payment.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 은행 송금 인보이스 응답 (content 는 Base64)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceResponse {

    @JsonProperty("file_name")
    private String fileName;

    private byte[] content;

    @JsonProperty("customer_id")
    private Long customerId;

    @JsonProperty("order_id")
    private Long orderId;

    private BigDecimal amount;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("valid_until")
    private LocalDateTime validUntil;
}
