package com.hhplus.checkout.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.order.dto.OrderLineView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 항목 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineResponse {

    @JsonProperty("order_line_id")
    private Long orderLineId;

    @JsonProperty("product_id")
    private Long productId;

    private Integer quantity;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("discount_percent")
    private Integer discountPercent;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static OrderLineResponse from(OrderLineView view) {
        return OrderLineResponse.builder()
                .orderLineId(view.getOrderLineId())
                .productId(view.getProductId())
                .quantity(view.getQuantity())
                .unitPrice(view.getUnitPrice())
                .discountPercent(view.getDiscountPercent())
                .lineTotal(view.getLineTotal())
                .updatedAt(view.getUpdatedAt())
                .build();
    }
}
