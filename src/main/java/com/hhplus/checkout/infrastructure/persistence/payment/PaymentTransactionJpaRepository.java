package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.PaymentTransaction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * PaymentTransaction JPA Repository
 */
public interface PaymentTransactionJpaRepository extends JpaRepository<PaymentTransaction, Long> {

    List<PaymentTransaction> findByOrderIdOrderByTransactionIdAsc(Long orderId);
}
