package com.hhplus.checkout.application.payment.strategy;

import com.hhplus.checkout.application.payment.dto.PaymentCommand;
import com.hhplus.checkout.domain.payment.PaymentMethodType;

/**
 * 결제 수단별 정산 전략 (Strategy Pattern)
 *
 * 구현체는 결제 수단마다 하나씩 빈으로 등록되고 PaymentService 가 코드로 선택한다.
 */
public interface PaymentStrategy {

    PaymentMethodType getType();

    /**
     * 결제 수단별 요청 정보 검증 (상태 변경 전 호출)
     *
     * @throws com.hhplus.checkout.domain.payment.InvalidPaymentRequestException 필수 정보 누락
     */
    default void validate(PaymentCommand command) {
    }

    /**
     * 정산 실행
     * 게이트웨이 전송 오류는 GatewayTransportException 으로 전파된다.
     */
    SettlementOutcome settle(PaymentContext context);
}
