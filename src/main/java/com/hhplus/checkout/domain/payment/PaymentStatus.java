package com.hhplus.checkout.domain.payment;

/**
 * PaymentStatus - 결제 트랜잭션(원장 행) 상태
 *
 * - PENDING: 비동기 정산 대기 (은행 송금)
 * - PROCESSING: 게이트웨이 호출 중
 * - COMPLETED: 결제 성공 (종결)
 * - FAILED: 결제 실패 (종결)
 *
 * PENDING/PROCESSING → COMPLETED/FAILED 만 허용. 종결된 행은 변경하지 않는다.
 */
public enum PaymentStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
