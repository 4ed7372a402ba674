package com.hhplus.checkout.application.order;

import com.hhplus.checkout.application.order.dto.OrderLineView;
import com.hhplus.checkout.application.order.dto.OrderSummary;
import com.hhplus.checkout.application.order.dto.TransactionView;
import com.hhplus.checkout.domain.customer.CustomerNotFoundException;
import com.hhplus.checkout.domain.customer.CustomerRepository;
import com.hhplus.checkout.domain.order.CustomerMismatchException;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderNotFoundException;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.domain.payment.PaymentTransactionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 조회 유스케이스
 *
 * - 고객 주문 목록 / 확정 이력 (PAID + CANCELLED)
 * - 단건 조회 (소유자 검증)
 * - 주문 항목, 결제 원장 행 조회
 */
@Service
@Transactional(readOnly = true)
public class OrderService {

    private static final EnumSet<OrderStatus> FINALIZED = EnumSet.of(OrderStatus.PAID, OrderStatus.CANCELLED);

    private final OrderRepository orderRepository;
    private final CustomerRepository customerRepository;
    private final PaymentTransactionRepository paymentTransactionRepository;
    private final OrderCalculator orderCalculator;

    public OrderService(OrderRepository orderRepository,
                        CustomerRepository customerRepository,
                        PaymentTransactionRepository paymentTransactionRepository,
                        OrderCalculator orderCalculator) {
        this.orderRepository = orderRepository;
        this.customerRepository = customerRepository;
        this.paymentTransactionRepository = paymentTransactionRepository;
        this.orderCalculator = orderCalculator;
    }

    public List<OrderSummary> getOrders(Long customerId) {
        validateCustomer(customerId);
        return toSummaries(orderRepository.findByCustomerId(customerId));
    }

    /**
     * 확정된 주문 이력 (최신순)
     */
    public List<OrderSummary> getOrderHistory(Long customerId) {
        validateCustomer(customerId);
        return toSummaries(orderRepository.findByCustomerIdAndStatusIn(customerId, FINALIZED));
    }

    public OrderSummary getOrder(Long customerId, Long orderId) {
        Order order = getOwnedOrder(customerId, orderId);
        return OrderSummary.of(order, orderCalculator.calculateOrderTotal(orderId));
    }

    public List<OrderLineView> getOrderLines(Long customerId, Long orderId) {
        getOwnedOrder(customerId, orderId);
        return orderRepository.findLinesByOrderId(orderId).stream()
                .map(OrderLineView::from)
                .collect(Collectors.toList());
    }

    public List<TransactionView> getTransactions(Long customerId, Long orderId) {
        getOwnedOrder(customerId, orderId);
        return paymentTransactionRepository.findByOrderId(orderId).stream()
                .map(TransactionView::from)
                .collect(Collectors.toList());
    }

    private Order getOwnedOrder(Long customerId, Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.isOwnedBy(customerId)) {
            throw new CustomerMismatchException(orderId, customerId);
        }
        return order;
    }

    private void validateCustomer(Long customerId) {
        if (!customerRepository.existsById(customerId)) {
            throw new CustomerNotFoundException(customerId);
        }
    }

    private List<OrderSummary> toSummaries(List<Order> orders) {
        return orders.stream()
                .map(order -> OrderSummary.of(order, orderCalculator.calculateOrderTotal(order.getOrderId())))
                .collect(Collectors.toList());
    }
}
