package com.hhplus.checkout.infrastructure.persistence.order;

import com.hhplus.checkout.domain.order.CartConflictException;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderEvent;
import com.hhplus.checkout.domain.order.OrderLine;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.order.OrderStateMachine;
import com.hhplus.checkout.domain.order.OrderStatus;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(OrderRepository) 인터페이스를 구현하면서 주문과 주문 항목을 함께 관리
 */
@Repository
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;
    private final OrderLineJpaRepository orderLineJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository,
                                OrderLineJpaRepository orderLineJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
        this.orderLineJpaRepository = orderLineJpaRepository;
    }

    @Override
    public Order save(Order order) {
        if (order.getOrderId() != null) {
            return orderJpaRepository.save(order);
        }
        try {
            // cart_owner_id 유니크 제약 위반을 이 시점에 확인하기 위해 즉시 flush
            return orderJpaRepository.saveAndFlush(order);
        } catch (DataIntegrityViolationException e) {
            throw new CartConflictException(order.getCustomerId(), e);
        }
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findById(orderId);
    }

    @Override
    public Optional<Order> findOpenByCustomerId(Long customerId) {
        return orderJpaRepository.findByCustomerIdAndStatus(customerId, OrderStatus.OPEN);
    }

    @Override
    public List<Order> findByCustomerId(Long customerId) {
        return orderJpaRepository.findByCustomerIdOrderByCreatedAtDescOrderIdDesc(customerId);
    }

    @Override
    public List<Order> findByCustomerIdAndStatusIn(Long customerId, Collection<OrderStatus> statuses) {
        return orderJpaRepository.findByCustomerIdAndStatusInOrderByCreatedAtDescOrderIdDesc(customerId, statuses);
    }

    @Override
    @Transactional
    public boolean transitionStatus(Long orderId, OrderStatus expected, OrderEvent event, LocalDateTime now) {
        OrderStatus target = OrderStateMachine.next(expected, event);
        LocalDateTime finalizedAt = target.isTerminal() ? now : null;
        return orderJpaRepository.updateStatusIfMatches(orderId, expected, target, now, finalizedAt) == 1;
    }

    @Override
    @Transactional
    public void delete(Order order) {
        orderLineJpaRepository.deleteAllByOrderId(order.getOrderId());
        orderJpaRepository.delete(order);
    }

    @Override
    public List<OrderLine> findLinesByOrderId(Long orderId) {
        return orderLineJpaRepository.findByOrderIdOrderByOrderLineIdAsc(orderId);
    }

    @Override
    public Optional<OrderLine> findLine(Long orderId, Long productId) {
        return orderLineJpaRepository.findByOrderIdAndProductId(orderId, productId);
    }

    @Override
    public OrderLine saveLine(OrderLine line) {
        return orderLineJpaRepository.save(line);
    }

    @Override
    public void deleteLine(OrderLine line) {
        orderLineJpaRepository.delete(line);
    }
}
