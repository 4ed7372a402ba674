package com.hhplus.checkout.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrderStateMachine 상태 전이 테이블 테스트")
class OrderStateMachineTest {

    @ParameterizedTest(name = "{0} + {1} → {2}")
    @CsvSource({
            "OPEN, CHECKOUT_STARTED, CHECKOUT",
            "CHECKOUT, PAYMENT_SUCCEEDED, PAID",
            "CHECKOUT, PAYMENT_FAILED, CANCELLED"
    })
    @DisplayName("허용된 전이")
    void next_AllowedTransitions(OrderStatus from, OrderEvent event, OrderStatus expected) {
        assertEquals(expected, OrderStateMachine.next(from, event));
        assertTrue(OrderStateMachine.canApply(from, event));
    }

    @ParameterizedTest(name = "{0} + {1} 거부")
    @CsvSource({
            "OPEN, PAYMENT_SUCCEEDED",
            "OPEN, PAYMENT_FAILED",
            "CHECKOUT, CHECKOUT_STARTED",
            "PAID, CHECKOUT_STARTED",
            "PAID, PAYMENT_SUCCEEDED",
            "PAID, PAYMENT_FAILED",
            "CANCELLED, CHECKOUT_STARTED",
            "CANCELLED, PAYMENT_SUCCEEDED",
            "CANCELLED, PAYMENT_FAILED"
    })
    @DisplayName("허용되지 않은 전이 - InvalidOrderStatusException")
    void next_RejectedTransitions(OrderStatus from, OrderEvent event) {
        assertThrows(InvalidOrderStatusException.class, () -> OrderStateMachine.next(from, event));
        assertFalse(OrderStateMachine.canApply(from, event));
    }

    @Test
    @DisplayName("종결 상태는 PAID, CANCELLED")
    void terminalStatuses() {
        assertFalse(OrderStatus.OPEN.isTerminal());
        assertFalse(OrderStatus.CHECKOUT.isTerminal());
        assertTrue(OrderStatus.PAID.isTerminal());
        assertTrue(OrderStatus.CANCELLED.isTerminal());
    }
}
