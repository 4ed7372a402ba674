package com.hhplus.checkout.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.order.dto.OrderSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("customer_id")
    private Long customerId;

    private String status;

    private BigDecimal total;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    @JsonProperty("finalized_at")
    private LocalDateTime finalizedAt;

    public static OrderResponse from(OrderSummary summary) {
        return OrderResponse.builder()
                .orderId(summary.getOrderId())
                .customerId(summary.getCustomerId())
                .status(summary.getStatus().name())
                .total(summary.getTotal())
                .createdAt(summary.getCreatedAt())
                .updatedAt(summary.getUpdatedAt())
                .finalizedAt(summary.getFinalizedAt())
                .build();
    }
}
