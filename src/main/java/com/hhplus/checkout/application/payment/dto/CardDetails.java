package com.hhplus.checkout.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 카드 결제 정보 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CardDetails {
    private String holderName;
    private String cardNumber;
    private Integer expirationMonth;
    private Integer expirationYear;
    private String cvv;

    @Override
    public String toString() {
        return "CardDetails(holderName=" + holderName + ", cardNumber=****)";
    }
}
