package com.hhplus.checkout.domain.order;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Order Repository Interface (Port)
 *
 * 주문(장바구니)과 주문 항목 저장소.
 * 구현체는 infrastructure 계층에 위치한다.
 */
public interface OrderRepository {

    /**
     * 주문 저장
     * 동일 고객의 OPEN 주문이 이미 있으면 CartConflictException
     */
    Order save(Order order);

    Optional<Order> findById(Long orderId);

    /**
     * 고객의 활성 장바구니(OPEN 주문) 조회
     */
    Optional<Order> findOpenByCustomerId(Long customerId);

    /**
     * 고객의 전체 주문 조회 (최신순)
     */
    List<Order> findByCustomerId(Long customerId);

    /**
     * 고객의 특정 상태 주문 조회 (최신순)
     */
    List<Order> findByCustomerIdAndStatusIn(Long customerId, Collection<OrderStatus> statuses);

    /**
     * 조건부 상태 전환
     *
     * 현재 상태가 expected 인 경우에만 event 를 적용한다.
     * (UPDATE ... WHERE order_id = ? AND status = ?)
     *
     * @return 전환되었으면 true, 다른 요청이 먼저 상태를 바꿨으면 false
     * @throws InvalidOrderStatusException expected 상태에서 허용되지 않는 이벤트
     */
    boolean transitionStatus(Long orderId, OrderStatus expected, OrderEvent event, LocalDateTime now);

    /**
     * 주문과 항목을 함께 삭제
     */
    void delete(Order order);

    // ========== 주문 항목 ==========

    List<OrderLine> findLinesByOrderId(Long orderId);

    Optional<OrderLine> findLine(Long orderId, Long productId);

    OrderLine saveLine(OrderLine line);

    void deleteLine(OrderLine line);
}
