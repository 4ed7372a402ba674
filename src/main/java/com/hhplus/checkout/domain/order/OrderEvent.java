package com.hhplus.checkout.domain.order;

/**
 * 주문 상태 전환을 일으키는 이벤트
 */
public enum OrderEvent {
    /** 결제 시도 시작 (외부 호출 전) */
    CHECKOUT_STARTED,
    /** 결제 수단이 성공을 보고함 */
    PAYMENT_SUCCEEDED,
    /** 결제 거절 또는 재시도 소진 */
    PAYMENT_FAILED
}
