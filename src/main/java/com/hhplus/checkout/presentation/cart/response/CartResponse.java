package com.hhplus.checkout.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.cart.dto.CartView;
import com.hhplus.checkout.presentation.order.response.OrderLineResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("customer_id")
    private Long customerId;

    @JsonProperty("total_quantity")
    private Integer totalQuantity;

    private BigDecimal total;

    private List<OrderLineResponse> lines;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static CartResponse from(CartView view) {
        return CartResponse.builder()
                .orderId(view.getOrderId())
                .customerId(view.getCustomerId())
                .totalQuantity(view.getTotalQuantity())
                .total(view.getTotal())
                .lines(view.getLines().stream()
                        .map(OrderLineResponse::from)
                        .collect(Collectors.toList()))
                .updatedAt(view.getUpdatedAt())
                .build();
    }
}
