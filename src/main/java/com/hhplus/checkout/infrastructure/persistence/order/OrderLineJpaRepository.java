package com.hhplus.checkout.infrastructure.persistence.order;

import com.hhplus.checkout.domain.order.OrderLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * OrderLine JPA Repository
 */
public interface OrderLineJpaRepository extends JpaRepository<OrderLine, Long> {

    List<OrderLine> findByOrderIdOrderByOrderLineIdAsc(Long orderId);

    Optional<OrderLine> findByOrderIdAndProductId(Long orderId, Long productId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM OrderLine l WHERE l.orderId = :orderId")
    int deleteAllByOrderId(@Param("orderId") Long orderId);
}
