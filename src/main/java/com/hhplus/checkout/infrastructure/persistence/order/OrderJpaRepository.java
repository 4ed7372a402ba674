package com.hhplus.checkout.infrastructure.persistence.order;

import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    Optional<Order> findByCustomerIdAndStatus(Long customerId, OrderStatus status);

    List<Order> findByCustomerIdOrderByCreatedAtDescOrderIdDesc(Long customerId);

    List<Order> findByCustomerIdAndStatusInOrderByCreatedAtDescOrderIdDesc(Long customerId, Collection<OrderStatus> statuses);

    /**
     * 조건부 상태 전환 (Compare-And-Set)
     *
     * SQL 생성:
     * UPDATE orders SET status=?, cart_owner_id=NULL, updated_at=?, finalized_at=?, version=version+1
     * WHERE order_id=? AND status=?
     *
     * 동시성 제어:
     * - 현재 상태가 expected 인 행만 갱신 → 동시 요청 중 하나만 1건 갱신
     * - version 을 함께 올려서 같은 주문을 들고 있는 다른 트랜잭션의 저장도 낙관적 락으로 실패
     *
     * @return 갱신된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = :target, o.cartOwnerId = NULL, o.updatedAt = :now, " +
           "o.finalizedAt = :finalizedAt, o.version = o.version + 1 " +
           "WHERE o.orderId = :orderId AND o.status = :expected")
    int updateStatusIfMatches(@Param("orderId") Long orderId,
                              @Param("expected") OrderStatus expected,
                              @Param("target") OrderStatus target,
                              @Param("now") LocalDateTime now,
                              @Param("finalizedAt") LocalDateTime finalizedAt);
}
