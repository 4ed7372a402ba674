package com.hhplus.checkout.domain.payment;

import java.util.List;
import java.util.Optional;

/**
 * PaymentMethod Repository Interface (Port)
 */
public interface PaymentMethodRepository {

    /**
     * 활성 결제 수단 조회 (코드 대소문자 무시)
     */
    Optional<PaymentMethod> findActiveByCode(String code);

    /**
     * 활성 결제 수단 목록 (displayOrder 오름차순)
     */
    List<PaymentMethod> findAllActive();
}
