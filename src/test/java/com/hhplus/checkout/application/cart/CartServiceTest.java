package com.hhplus.checkout.application.cart;

import com.hhplus.checkout.application.cart.dto.AddCartItemCommand;
import com.hhplus.checkout.application.cart.dto.CartView;
import com.hhplus.checkout.application.order.OrderCalculator;
import com.hhplus.checkout.domain.customer.CustomerNotFoundException;
import com.hhplus.checkout.domain.order.CartLineNotFoundException;
import com.hhplus.checkout.domain.order.InvalidQuantityException;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderEvent;
import com.hhplus.checkout.domain.order.OrderNotMutableException;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.domain.product.InsufficientStockException;
import com.hhplus.checkout.domain.product.ProductNotFoundException;
import com.hhplus.checkout.infrastructure.persistence.customer.InMemoryCustomerRepository;
import com.hhplus.checkout.infrastructure.persistence.order.InMemoryOrderRepository;
import com.hhplus.checkout.infrastructure.persistence.product.InMemoryProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CartService 단위 테스트
 * - 인메모리 저장소로 장바구니 생명주기 검증
 */
@DisplayName("CartService 단위 테스트")
class CartServiceTest {

    private static final Long CUSTOMER_ID = 1L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-10T09:00:00Z"), ZoneOffset.UTC);

    private InMemoryOrderRepository orderRepository;
    private InMemoryProductRepository productRepository;
    private CartService cartService;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        productRepository = new InMemoryProductRepository();
        InMemoryCustomerRepository customerRepository = new InMemoryCustomerRepository();
        customerRepository.add(CUSTOMER_ID);
        productRepository.add(1L, "10.00", 0, 100);
        productRepository.add(2L, "20.00", 50, 100);
        productRepository.add(3L, "59.99", 10, 5);

        cartService = new CartService(orderRepository, productRepository, customerRepository,
                new OrderCalculator(orderRepository), CLOCK);
    }

    private CartView add(Long productId, Integer quantity) {
        return cartService.addItem(CUSTOMER_ID, new AddCartItemCommand(productId, quantity));
    }

    @Nested
    @DisplayName("장바구니 담기")
    class AddItem {

        @Test
        @DisplayName("첫 상품 - OPEN 주문 생성, 합계 계산")
        void addItem_CreatesCart() {
            // When
            CartView cart = add(1L, 2);

            // Then
            assertNotNull(cart.getOrderId());
            assertEquals(1, cart.getLines().size());
            assertEquals(2, cart.getTotalQuantity());
            assertEquals(new BigDecimal("20.00"), cart.getTotal());
            Order order = orderRepository.findById(cart.getOrderId()).orElseThrow();
            assertEquals(OrderStatus.OPEN, order.getStatus());
        }

        @Test
        @DisplayName("수량 생략 시 1개")
        void addItem_DefaultQuantity() {
            CartView cart = add(2L, null);

            assertEquals(1, cart.getTotalQuantity());
            assertEquals(new BigDecimal("10.00"), cart.getTotal());
        }

        @Test
        @DisplayName("같은 상품 다시 담기 - 같은 주문에서 수량 증가")
        void addItem_SameProductIncrements() {
            // Given
            CartView first = add(1L, 2);

            // When
            CartView second = add(1L, 3);

            // Then
            assertEquals(first.getOrderId(), second.getOrderId());
            assertEquals(1, second.getLines().size());
            assertEquals(5, second.getTotalQuantity());
            assertEquals(1, orderRepository.findAll().size());
        }

        @Test
        @DisplayName("담는 시점의 가격/할인율 스냅샷")
        void addItem_SnapshotsPrice() {
            // Given
            add(2L, 1);

            // When - 카탈로그 가격이 바뀌어도
            productRepository.add(2L, "99.00", 0, 100);
            CartView cart = cartService.getCart(CUSTOMER_ID);

            // Then
            assertEquals(new BigDecimal("10.00"), cart.getTotal());
        }

        @Test
        @DisplayName("재고 초과 - InsufficientStockException, 기존 수량 유지")
        void addItem_InsufficientStock() {
            // Given
            add(3L, 4);

            // When & Then
            assertThrows(InsufficientStockException.class, () -> add(3L, 2));
            assertEquals(4, cartService.getCart(CUSTOMER_ID).getTotalQuantity());
        }

        @Test
        @DisplayName("잘못된 수량/상품/고객")
        void addItem_InvalidInput() {
            assertThrows(InvalidQuantityException.class, () -> add(1L, 0));
            assertThrows(ProductNotFoundException.class, () -> add(999L, 1));
            assertThrows(CustomerNotFoundException.class,
                    () -> cartService.addItem(999L, new AddCartItemCommand(1L, 1)));
            assertTrue(orderRepository.findAll().isEmpty());
        }

        @Test
        @DisplayName("결제 진행 중에는 새 장바구니가 생성됨")
        void addItem_AfterCheckoutStartsNewCart() {
            // Given
            CartView first = add(1L, 1);
            orderRepository.transitionStatus(first.getOrderId(), OrderStatus.OPEN, OrderEvent.CHECKOUT_STARTED,
                    LocalDateTime.now(CLOCK));

            // When
            CartView second = add(2L, 1);

            // Then
            assertNotEquals(first.getOrderId(), second.getOrderId());
            assertEquals(1, orderRepository.findLinesByOrderId(first.getOrderId()).size());
        }
    }

    @Nested
    @DisplayName("수량 변경 / 삭제")
    class UpdateAndRemove {

        @Test
        @DisplayName("수량 변경")
        void updateQuantity() {
            add(1L, 1);

            CartView cart = cartService.updateQuantity(CUSTOMER_ID, 1L, 4);

            assertEquals(4, cart.getTotalQuantity());
            assertEquals(new BigDecimal("40.00"), cart.getTotal());
        }

        @Test
        @DisplayName("수량 0 - 항목 삭제")
        void updateQuantity_ZeroRemoves() {
            add(1L, 1);
            add(2L, 1);

            CartView cart = cartService.updateQuantity(CUSTOMER_ID, 1L, 0);

            assertThat(cart.getLines()).extracting("productId").containsExactly(2L);
        }

        @Test
        @DisplayName("마지막 항목 삭제 - 장바구니 삭제")
        void removeItem_LastLineDeletesCart() {
            // Given
            CartView before = add(1L, 1);

            // When
            CartView cart = cartService.removeItem(CUSTOMER_ID, 1L);

            // Then
            assertNull(cart.getOrderId());
            assertEquals(new BigDecimal("0.00"), cart.getTotal());
            assertTrue(orderRepository.findById(before.getOrderId()).isEmpty());
            assertTrue(orderRepository.findLinesByOrderId(before.getOrderId()).isEmpty());
        }

        @Test
        @DisplayName("장바구니에 없는 상품 - CartLineNotFoundException")
        void removeItem_NotInCart() {
            assertThrows(CartLineNotFoundException.class, () -> cartService.removeItem(CUSTOMER_ID, 1L));
            add(1L, 1);
            assertThrows(CartLineNotFoundException.class, () -> cartService.updateQuantity(CUSTOMER_ID, 2L, 3));
        }

        @Test
        @DisplayName("장바구니 비우기")
        void clearCart() {
            add(1L, 1);
            add(2L, 2);

            cartService.clearCart(CUSTOMER_ID);

            assertTrue(orderRepository.findOpenByCustomerId(CUSTOMER_ID).isEmpty());
            assertEquals(0, cartService.getCart(CUSTOMER_ID).getTotalQuantity());
        }
    }

    @Test
    @DisplayName("CHECKOUT 주문은 변경 불가")
    void checkoutOrder_IsImmutable() {
        // Given
        CartView cart = add(1L, 1);
        Order order = orderRepository.findById(cart.getOrderId()).orElseThrow();
        order.apply(OrderEvent.CHECKOUT_STARTED, LocalDateTime.now(CLOCK));

        // When & Then
        assertThrows(OrderNotMutableException.class, order::assertMutable);
        assertThrows(CartLineNotFoundException.class, () -> cartService.updateQuantity(CUSTOMER_ID, 1L, 2));
    }
}
