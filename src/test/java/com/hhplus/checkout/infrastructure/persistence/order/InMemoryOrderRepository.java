package com.hhplus.checkout.infrastructure.persistence.order;

import com.hhplus.checkout.domain.order.CartConflictException;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderEvent;
import com.hhplus.checkout.domain.order.OrderLine;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.order.OrderStatus;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemoryOrderRepository - Order 저장소 구현체 (인메모리, 테스트용)
 * ConcurrentHashMap을 사용하여 스레드 안전성 제공
 *
 * transitionStatus 는 synchronized 로 조건부 UPDATE 와 같은 원자성을 흉내낸다.
 */
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentHashMap<Long, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, OrderLine> lines = new ConcurrentHashMap<>();
    private final AtomicLong orderIdSequence = new AtomicLong(5000L);
    private final AtomicLong orderLineIdSequence = new AtomicLong(7000L);

    @Override
    public synchronized Order save(Order order) {
        if (order.getOrderId() != null) {
            orders.put(order.getOrderId(), order);
            return order;
        }
        boolean openCartExists = orders.values().stream()
                .anyMatch(existing -> order.getCartOwnerId() != null
                        && order.getCartOwnerId().equals(existing.getCartOwnerId()));
        if (openCartExists) {
            throw new CartConflictException(order.getCustomerId(),
                    new IllegalStateException("duplicate cart_owner_id=" + order.getCartOwnerId()));
        }

        // Builder 패턴을 사용하여 ID가 할당된 새 Order 생성
        Order saved = Order.builder()
                .orderId(orderIdSequence.incrementAndGet())
                .customerId(order.getCustomerId())
                .status(order.getStatus())
                .cartOwnerId(order.getCartOwnerId())
                .version(0L)
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .finalizedAt(order.getFinalizedAt())
                .build();
        orders.put(saved.getOrderId(), saved);
        return saved;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public Optional<Order> findOpenByCustomerId(Long customerId) {
        return orders.values().stream()
                .filter(order -> order.getCustomerId().equals(customerId) && order.isOpen())
                .findFirst();
    }

    @Override
    public List<Order> findByCustomerId(Long customerId) {
        return orders.values().stream()
                .filter(order -> order.getCustomerId().equals(customerId))
                .sorted(Comparator.comparing(Order::getOrderId).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<Order> findByCustomerIdAndStatusIn(Long customerId, Collection<OrderStatus> statuses) {
        return findByCustomerId(customerId).stream()
                .filter(order -> statuses.contains(order.getStatus()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean transitionStatus(Long orderId, OrderStatus expected, OrderEvent event, LocalDateTime now) {
        Order order = orders.get(orderId);
        if (order == null || order.getStatus() != expected) {
            return false;
        }
        order.apply(event, now);
        return true;
    }

    @Override
    public synchronized void delete(Order order) {
        lines.values().removeIf(line -> line.getOrderId().equals(order.getOrderId()));
        orders.remove(order.getOrderId());
    }

    @Override
    public List<OrderLine> findLinesByOrderId(Long orderId) {
        return lines.values().stream()
                .filter(line -> line.getOrderId().equals(orderId))
                .sorted(Comparator.comparing(OrderLine::getOrderLineId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<OrderLine> findLine(Long orderId, Long productId) {
        return lines.values().stream()
                .filter(line -> line.getOrderId().equals(orderId) && line.getProductId().equals(productId))
                .findFirst();
    }

    @Override
    public OrderLine saveLine(OrderLine line) {
        if (line.getOrderLineId() != null) {
            lines.put(line.getOrderLineId(), line);
            return line;
        }
        OrderLine saved = OrderLine.builder()
                .orderLineId(orderLineIdSequence.incrementAndGet())
                .orderId(line.getOrderId())
                .productId(line.getProductId())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .discountPercent(line.getDiscountPercent())
                .createdAt(line.getCreatedAt())
                .updatedAt(line.getUpdatedAt())
                .build();
        lines.put(saved.getOrderLineId(), saved);
        return saved;
    }

    @Override
    public void deleteLine(OrderLine line) {
        lines.remove(line.getOrderLineId());
    }

    /**
     * 테스트용: 전체 주문 조회
     */
    public List<Order> findAll() {
        return new ArrayList<>(orders.values());
    }
}
