package com.hhplus.checkout.application.order.dto;

import com.hhplus.checkout.domain.order.OrderLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * 주문 항목 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineView {
    private Long orderLineId;
    private Long productId;
    private Integer quantity;
    private BigDecimal unitPrice;
    private Integer discountPercent;
    private BigDecimal lineTotal;
    private LocalDateTime updatedAt;

    public static OrderLineView from(OrderLine line) {
        return OrderLineView.builder()
                .orderLineId(line.getOrderLineId())
                .productId(line.getProductId())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .discountPercent(line.getDiscountPercent())
                .lineTotal(line.getLineTotal().setScale(2, RoundingMode.HALF_UP))
                .updatedAt(line.getUpdatedAt())
                .build();
    }
}
