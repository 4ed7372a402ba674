package com.hhplus.checkout.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Order 도메인 테스트")
class OrderTest {

    private static final LocalDateTime CREATED = LocalDateTime.of(2024, 1, 10, 9, 0);
    private static final LocalDateTime LATER = CREATED.plusMinutes(5);

    @Test
    @DisplayName("장바구니 생성 - OPEN, cartOwnerId = customerId")
    void openCart() {
        // When
        Order order = Order.openCart(100L, CREATED);

        // Then
        assertEquals(OrderStatus.OPEN, order.getStatus());
        assertEquals(100L, order.getCartOwnerId());
        assertEquals(CREATED, order.getCreatedAt());
        assertEquals(CREATED, order.getUpdatedAt());
        assertNull(order.getFinalizedAt());
        assertTrue(order.isOpen());
        assertTrue(order.isOwnedBy(100L));
        assertFalse(order.isOwnedBy(200L));
    }

    @Test
    @DisplayName("customerId 없이 장바구니 생성 불가")
    void openCart_NullCustomer() {
        assertThrows(IllegalArgumentException.class, () -> Order.openCart(null, CREATED));
    }

    @Test
    @DisplayName("결제 시작 - CHECKOUT, cartOwnerId 해제, finalizedAt 없음")
    void apply_CheckoutStarted() {
        // Given
        Order order = Order.openCart(100L, CREATED);

        // When
        order.apply(OrderEvent.CHECKOUT_STARTED, LATER);

        // Then
        assertEquals(OrderStatus.CHECKOUT, order.getStatus());
        assertNull(order.getCartOwnerId());
        assertEquals(LATER, order.getUpdatedAt());
        assertNull(order.getFinalizedAt());
    }

    @Test
    @DisplayName("결제 성공 - PAID, finalizedAt 기록")
    void apply_PaymentSucceeded() {
        // Given
        Order order = Order.openCart(100L, CREATED);
        order.apply(OrderEvent.CHECKOUT_STARTED, CREATED);

        // When
        order.apply(OrderEvent.PAYMENT_SUCCEEDED, LATER);

        // Then
        assertEquals(OrderStatus.PAID, order.getStatus());
        assertEquals(LATER, order.getFinalizedAt());
    }

    @Test
    @DisplayName("CANCELLED 주문에 이벤트 적용 불가 - 상태 유지")
    void apply_FromCancelled_Rejected() {
        // Given
        Order order = Order.openCart(100L, CREATED);
        order.apply(OrderEvent.CHECKOUT_STARTED, CREATED);
        order.apply(OrderEvent.PAYMENT_FAILED, CREATED);

        // When & Then
        assertThrows(InvalidOrderStatusException.class, () -> order.apply(OrderEvent.PAYMENT_SUCCEEDED, LATER));
        assertEquals(OrderStatus.CANCELLED, order.getStatus());
        assertEquals(CREATED, order.getFinalizedAt());
    }

    @Test
    @DisplayName("OPEN 이 아닌 주문은 장바구니 변경 불가")
    void touch_NotOpen() {
        // Given
        Order order = Order.openCart(100L, CREATED);
        order.apply(OrderEvent.CHECKOUT_STARTED, CREATED);

        // When & Then
        assertThrows(OrderNotMutableException.class, () -> order.touch(LATER));
        assertEquals(CREATED, order.getUpdatedAt());
    }
}
