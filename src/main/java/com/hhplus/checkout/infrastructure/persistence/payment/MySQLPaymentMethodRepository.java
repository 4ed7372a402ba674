package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.PaymentMethod;
import com.hhplus.checkout.domain.payment.PaymentMethodRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 결제 수단 Repository 구현
 */
@Repository
public class MySQLPaymentMethodRepository implements PaymentMethodRepository {

    private final PaymentMethodJpaRepository paymentMethodJpaRepository;

    public MySQLPaymentMethodRepository(PaymentMethodJpaRepository paymentMethodJpaRepository) {
        this.paymentMethodJpaRepository = paymentMethodJpaRepository;
    }

    @Override
    public Optional<PaymentMethod> findActiveByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return paymentMethodJpaRepository.findByCodeIgnoreCaseAndActiveTrue(code.trim());
    }

    @Override
    public List<PaymentMethod> findAllActive() {
        return paymentMethodJpaRepository.findByActiveTrueOrderByDisplayOrderAsc();
    }
}
