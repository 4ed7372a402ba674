package com.hhplus.checkout.domain.order;

/**
 * OrderStatus - 도메인 값 객체 (Enum)
 *
 * 주문의 생명주기 상태를 나타냅니다.
 * - OPEN: 장바구니 (변경 가능)
 * - CHECKOUT: 결제 진행 중
 * - PAID: 결제 완료 (종결)
 * - CANCELLED: 결제 실패로 취소 (종결)
 *
 * 상태 전환 규칙은 OrderStateMachine 참고.
 */
public enum OrderStatus {
    OPEN,
    CHECKOUT,
    PAID,
    CANCELLED;

    public boolean isTerminal() {
        return this == PAID || this == CANCELLED;
    }
}
