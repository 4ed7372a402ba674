package com.hhplus.checkout.application.payment.strategy;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 결제 수단 전략의 실행 결과
 *
 * - PENDING: 비동기 정산 (주문은 CHECKOUT 유지)
 * - APPROVED: 게이트웨이 승인 → 주문 PAID
 * - DECLINED: 거절 또는 재시도 소진 → 주문 CANCELLED
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementOutcome {

    public enum Kind {
        PENDING, APPROVED, DECLINED
    }

    private final Kind kind;
    private final String externalTransactionId;
    private final String reason;
    private final Object document;

    public static SettlementOutcome pending(Object document) {
        return new SettlementOutcome(Kind.PENDING, null, null, document);
    }

    public static SettlementOutcome approved(String externalTransactionId) {
        return new SettlementOutcome(Kind.APPROVED, externalTransactionId, null, null);
    }

    public static SettlementOutcome declined(String reason) {
        return new SettlementOutcome(Kind.DECLINED, null, reason, null);
    }
}
