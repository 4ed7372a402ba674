package com.hhplus.checkout.presentation.payment.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 요청 DTO
 *
 * {
 *   "method": "card",
 *   "card": { "holder_name": "...", "card_number": "...", "expiration_month": 12, "expiration_year": 2030, "cvv": "123" }
 * }
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {
    private String method;
    private CardDetailsRequest card;
}
