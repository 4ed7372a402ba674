package com.hhplus.checkout.application.cart.dto;

import com.hhplus.checkout.application.order.dto.OrderLineView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * 장바구니 조회 결과 (Application layer 내부 DTO)
 * 활성 장바구니가 없으면 orderId 가 null 인 빈 장바구니
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartView {
    private Long orderId;
    private Long customerId;
    private List<OrderLineView> lines;
    private Integer totalQuantity;
    private BigDecimal total;
    private LocalDateTime updatedAt;

    public static CartView empty(Long customerId) {
        return CartView.builder()
                .customerId(customerId)
                .lines(Collections.emptyList())
                .totalQuantity(0)
                .total(BigDecimal.ZERO.setScale(2))
                .build();
    }
}
