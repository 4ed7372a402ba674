package com.hhplus.checkout.presentation.order;

import com.hhplus.checkout.application.order.OrderService;
import com.hhplus.checkout.presentation.order.response.OrderLineResponse;
import com.hhplus.checkout.presentation.order.response.OrderResponse;
import com.hhplus.checkout.presentation.order.response.TransactionResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderController - Presentation 계층
 * 주문 조회 API 요청 처리
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    /**
     * GET /orders - 고객 주문 목록 (최신순)
     */
    @GetMapping
    public ResponseEntity<List<OrderResponse>> getOrders(@RequestHeader("X-USER-ID") Long customerId) {
        return ResponseEntity.ok(orderService.getOrders(customerId).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList()));
    }

    /**
     * GET /orders/history - 확정 주문 이력 (PAID, CANCELLED)
     */
    @GetMapping("/history")
    public ResponseEntity<List<OrderResponse>> getOrderHistory(@RequestHeader("X-USER-ID") Long customerId) {
        return ResponseEntity.ok(orderService.getOrderHistory(customerId).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList()));
    }

    /**
     * GET /orders/{order_id} - 주문 상세
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrder(
            @RequestHeader("X-USER-ID") Long customerId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(OrderResponse.from(orderService.getOrder(customerId, orderId)));
    }

    /**
     * GET /orders/{order_id}/lines - 주문 항목
     */
    @GetMapping("/{order_id}/lines")
    public ResponseEntity<List<OrderLineResponse>> getOrderLines(
            @RequestHeader("X-USER-ID") Long customerId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderService.getOrderLines(customerId, orderId).stream()
                .map(OrderLineResponse::from)
                .collect(Collectors.toList()));
    }

    /**
     * GET /orders/{order_id}/transactions - 결제 시도 이력
     */
    @GetMapping("/{order_id}/transactions")
    public ResponseEntity<List<TransactionResponse>> getTransactions(
            @RequestHeader("X-USER-ID") Long customerId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderService.getTransactions(customerId, orderId).stream()
                .map(TransactionResponse::from)
                .collect(Collectors.toList()));
    }
}
