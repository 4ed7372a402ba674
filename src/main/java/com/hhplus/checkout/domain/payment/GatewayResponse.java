package com.hhplus.checkout.domain.payment;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 게이트웨이 호출 결과
 */
@Getter
@AllArgsConstructor
public class GatewayResponse {

    private final boolean approved;

    /** 게이트웨이가 돌려준 거래 ID (없을 수 있음) */
    private final String externalTransactionId;

    /** 거절 시 HTTP 상태 등 사유 */
    private final String reason;

    public static GatewayResponse approved(String externalTransactionId) {
        return new GatewayResponse(true, externalTransactionId, null);
    }

    public static GatewayResponse declined(String reason) {
        return new GatewayResponse(false, null, reason);
    }
}
