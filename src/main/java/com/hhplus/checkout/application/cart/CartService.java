package com.hhplus.checkout.application.cart;

import com.hhplus.checkout.application.cart.dto.AddCartItemCommand;
import com.hhplus.checkout.application.cart.dto.CartView;
import com.hhplus.checkout.application.order.OrderCalculator;
import com.hhplus.checkout.application.order.dto.OrderLineView;
import com.hhplus.checkout.domain.customer.CustomerNotFoundException;
import com.hhplus.checkout.domain.customer.CustomerRepository;
import com.hhplus.checkout.domain.order.CartLineNotFoundException;
import com.hhplus.checkout.domain.order.InvalidQuantityException;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderLine;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.product.CatalogProduct;
import com.hhplus.checkout.domain.product.InsufficientStockException;
import com.hhplus.checkout.domain.product.ProductNotFoundException;
import com.hhplus.checkout.domain.product.ProductRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CartService - 장바구니(OPEN 주문) 유스케이스
 *
 * 비즈니스 규칙:
 * - 첫 상품을 담을 때 OPEN 주문이 생성된다 (고객당 최대 1개)
 * - 담는 시점의 가격/할인율을 스냅샷으로 저장
 * - 같은 상품을 다시 담으면 수량 증가 (재고 재확인)
 * - 수량을 0 이하로 바꾸면 항목 삭제
 * - 마지막 항목이 삭제되면 장바구니(주문)도 삭제
 *
 * 아키텍처:
 * - Domain 계층의 Repository 인터페이스에만 의존 (Port)
 */
@Slf4j
@Service
public class CartService {

    private static final int DEFAULT_QUANTITY = 1;

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final CustomerRepository customerRepository;
    private final OrderCalculator orderCalculator;
    private final Clock clock;

    public CartService(OrderRepository orderRepository,
                       ProductRepository productRepository,
                       CustomerRepository customerRepository,
                       OrderCalculator orderCalculator,
                       Clock clock) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.customerRepository = customerRepository;
        this.orderCalculator = orderCalculator;
        this.clock = clock;
    }

    /**
     * 장바구니에 상품 담기
     */
    @Transactional
    public CartView addItem(Long customerId, AddCartItemCommand command) {
        validateCustomer(customerId);
        int quantity = command.getQuantity() == null ? DEFAULT_QUANTITY : command.getQuantity();
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }

        CatalogProduct product = productRepository.findById(command.getProductId())
                .orElseThrow(() -> new ProductNotFoundException(command.getProductId()));
        LocalDateTime now = LocalDateTime.now(clock);

        Order cart = orderRepository.findOpenByCustomerId(customerId)
                .orElseGet(() -> orderRepository.save(Order.openCart(customerId, now)));

        OrderLine line = orderRepository.findLine(cart.getOrderId(), product.getProductId()).orElse(null);
        int requested = line == null ? quantity : line.getQuantity() + quantity;
        checkStock(product, requested);

        if (line == null) {
            orderRepository.saveLine(OrderLine.snapshotOf(cart.getOrderId(), product, quantity, now));
        } else {
            line.changeQuantity(requested, now);
            orderRepository.saveLine(line);
        }
        cart.touch(now);
        orderRepository.save(cart);

        log.info("[CartService] 장바구니 담기 - customerId={}, orderId={}, productId={}, quantity={}",
                customerId, cart.getOrderId(), product.getProductId(), requested);
        return toView(cart);
    }

    /**
     * 항목 수량 변경 (0 이하면 삭제)
     */
    @Transactional
    public CartView updateQuantity(Long customerId, Long productId, int quantity) {
        if (quantity <= 0) {
            return removeItem(customerId, productId);
        }
        Order cart = getOpenCart(customerId, productId);
        OrderLine line = orderRepository.findLine(cart.getOrderId(), productId)
                .orElseThrow(() -> new CartLineNotFoundException(customerId, productId));
        CatalogProduct product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        checkStock(product, quantity);

        LocalDateTime now = LocalDateTime.now(clock);
        line.changeQuantity(quantity, now);
        orderRepository.saveLine(line);
        cart.touch(now);
        orderRepository.save(cart);
        return toView(cart);
    }

    /**
     * 항목 삭제 (마지막 항목이면 장바구니 삭제)
     */
    @Transactional
    public CartView removeItem(Long customerId, Long productId) {
        Order cart = getOpenCart(customerId, productId);
        OrderLine line = orderRepository.findLine(cart.getOrderId(), productId)
                .orElseThrow(() -> new CartLineNotFoundException(customerId, productId));

        LocalDateTime now = LocalDateTime.now(clock);
        cart.touch(now);
        orderRepository.deleteLine(line);

        if (orderRepository.findLinesByOrderId(cart.getOrderId()).isEmpty()) {
            orderRepository.delete(cart);
            log.info("[CartService] 마지막 항목 삭제로 장바구니 삭제 - customerId={}, orderId={}",
                    customerId, cart.getOrderId());
            return CartView.empty(customerId);
        }
        orderRepository.save(cart);
        return toView(cart);
    }

    @Transactional(readOnly = true)
    public CartView getCart(Long customerId) {
        validateCustomer(customerId);
        return orderRepository.findOpenByCustomerId(customerId)
                .map(this::toView)
                .orElseGet(() -> CartView.empty(customerId));
    }

    /**
     * 장바구니 비우기 (OPEN 주문과 항목 삭제)
     */
    @Transactional
    public void clearCart(Long customerId) {
        validateCustomer(customerId);
        orderRepository.findOpenByCustomerId(customerId).ifPresent(cart -> {
            cart.assertMutable();
            orderRepository.delete(cart);
            log.info("[CartService] 장바구니 비우기 - customerId={}, orderId={}", customerId, cart.getOrderId());
        });
    }

    private Order getOpenCart(Long customerId, Long productId) {
        validateCustomer(customerId);
        return orderRepository.findOpenByCustomerId(customerId)
                .orElseThrow(() -> new CartLineNotFoundException(customerId, productId));
    }

    private void checkStock(CatalogProduct product, int quantity) {
        if (!product.hasStock(quantity)) {
            throw new InsufficientStockException(product.getProductId(), quantity, product.getUnitsInStock());
        }
    }

    private void validateCustomer(Long customerId) {
        if (!customerRepository.existsById(customerId)) {
            throw new CustomerNotFoundException(customerId);
        }
    }

    private CartView toView(Order cart) {
        List<OrderLine> lines = orderRepository.findLinesByOrderId(cart.getOrderId());
        List<OrderLineView> lineViews = lines.stream()
                .map(OrderLineView::from)
                .collect(Collectors.toList());
        return CartView.builder()
                .orderId(cart.getOrderId())
                .customerId(cart.getCustomerId())
                .lines(lineViews)
                .totalQuantity(lines.stream().mapToInt(OrderLine::getQuantity).sum())
                .total(orderCalculator.calculateTotal(lines))
                .updatedAt(cart.getUpdatedAt())
                .build();
    }
}
