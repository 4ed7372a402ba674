package com.hhplus.checkout.domain.payment;

/**
 * 외부 결제 게이트웨이 Port
 *
 * 구현체는 제한 횟수 재시도 정책을 적용한다.
 * - 승인/거절은 GatewayResponse 로 반환
 * - 마지막 시도의 전송 오류는 GatewayTransportException 으로 전파
 */
public interface PaymentGatewayClient {

    /**
     * 카드 결제
     *
     * @param idempotencyKey 같은 결제 시도의 모든 재시도에 동일하게 전송
     */
    GatewayResponse payByCard(CardPaymentRequest request, String idempotencyKey);

    /**
     * 단말기 결제
     *
     * @param idempotencyKey 같은 결제 시도의 모든 재시도에 동일하게 전송
     */
    GatewayResponse payByTerminal(TerminalPaymentRequest request, String idempotencyKey);
}
