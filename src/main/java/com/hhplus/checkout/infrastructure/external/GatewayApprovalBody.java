package com.hhplus.checkout.infrastructure.external;

import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 게이트웨이 승인 응답 본문 (선택)
 */
@Getter
@NoArgsConstructor
public class GatewayApprovalBody {
    private String transactionId;
}
