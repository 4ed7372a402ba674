package com.hhplus.checkout.application.order.dto;

import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSummary {
    private Long orderId;
    private Long customerId;
    private OrderStatus status;
    private BigDecimal total;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime finalizedAt;

    public static OrderSummary of(Order order, BigDecimal total) {
        return OrderSummary.builder()
                .orderId(order.getOrderId())
                .customerId(order.getCustomerId())
                .status(order.getStatus())
                .total(total)
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .finalizedAt(order.getFinalizedAt())
                .build();
    }
}
