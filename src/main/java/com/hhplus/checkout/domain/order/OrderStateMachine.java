package com.hhplus.checkout.domain.order;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * OrderStateMachine - 주문 상태 전이 테이블
 *
 * (현재 상태, 이벤트) → 다음 상태
 *
 * OPEN     + CHECKOUT_STARTED  → CHECKOUT
 * CHECKOUT + PAYMENT_SUCCEEDED → PAID
 * CHECKOUT + PAYMENT_FAILED    → CANCELLED
 *
 * 테이블에 없는 조합은 모두 InvalidOrderStatusException.
 * PAID, CANCELLED 에서 나가는 전이는 없다. CHECKOUT → OPEN 롤백도 없다.
 */
public final class OrderStateMachine {

    private static final Map<OrderStatus, Map<OrderEvent, OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        register(OrderStatus.OPEN, OrderEvent.CHECKOUT_STARTED, OrderStatus.CHECKOUT);
        register(OrderStatus.CHECKOUT, OrderEvent.PAYMENT_SUCCEEDED, OrderStatus.PAID);
        register(OrderStatus.CHECKOUT, OrderEvent.PAYMENT_FAILED, OrderStatus.CANCELLED);
    }

    private OrderStateMachine() {
    }

    private static void register(OrderStatus from, OrderEvent event, OrderStatus to) {
        TRANSITIONS.computeIfAbsent(from, key -> new EnumMap<>(OrderEvent.class)).put(event, to);
    }

    /**
     * 다음 상태 조회
     *
     * @throws InvalidOrderStatusException 허용되지 않은 전이
     */
    public static OrderStatus next(OrderStatus from, OrderEvent event) {
        OrderStatus to = TRANSITIONS.getOrDefault(from, Collections.emptyMap()).get(event);
        if (to == null) {
            throw new InvalidOrderStatusException(from, event);
        }
        return to;
    }

    public static boolean canApply(OrderStatus from, OrderEvent event) {
        return TRANSITIONS.getOrDefault(from, Collections.emptyMap()).containsKey(event);
    }
}
