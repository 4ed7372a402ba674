package com.hhplus.checkout.application.order;

import com.hhplus.checkout.domain.order.OrderLine;
import com.hhplus.checkout.domain.order.OrderRepository;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * OrderCalculator - 주문 금액 계산 전담
 *
 * 알고리즘:
 * 합계 = Σ(단가 × 수량 × (100 - 할인율) / 100), 소수 둘째 자리 HALF_UP
 *
 * 설계 원칙:
 * - 결제 금액을 결정하는 유일한 계산식
 * - 주문 행에 금액을 캐시하지 않음: 결제 시도마다 저장소에서 항목을 다시 읽어 계산
 * - 항목이 없으면 정확히 0.00
 */
@Component
public class OrderCalculator {

    public static final int MONEY_SCALE = 2;

    private final OrderRepository orderRepository;

    public OrderCalculator(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    /**
     * 주문 ID 기준 합계 (저장소의 최신 항목으로 계산)
     *
     * @param orderId 주문 ID
     * @return 합계 금액
     */
    public BigDecimal calculateOrderTotal(Long orderId) {
        return calculateTotal(orderRepository.findLinesByOrderId(orderId));
    }

    /**
     * 항목 목록 합계
     *
     * @param lines 주문 항목 목록
     * @return 합계 금액 (scale 2)
     */
    public BigDecimal calculateTotal(List<OrderLine> lines) {
        BigDecimal total = BigDecimal.ZERO;
        for (OrderLine line : lines) {
            total = total.add(line.getLineTotal());
        }
        return total.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
