package com.hhplus.checkout.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 요청 커맨드 (Application layer 내부 DTO)
 * card 는 method=card 일 때만 필요
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentCommand {
    private String method;
    private CardDetails card;
}
