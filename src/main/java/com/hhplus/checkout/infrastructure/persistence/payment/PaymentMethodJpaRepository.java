package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.PaymentMethod;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * PaymentMethod JPA Repository
 */
public interface PaymentMethodJpaRepository extends JpaRepository<PaymentMethod, String> {

    Optional<PaymentMethod> findByCodeIgnoreCaseAndActiveTrue(String code);

    List<PaymentMethod> findByActiveTrueOrderByDisplayOrderAsc();
}
