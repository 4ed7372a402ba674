package com.hhplus.checkout.domain.payment;

import lombok.*;

import java.math.BigDecimal;

/**
 * 카드 결제 게이트웨이 요청 본문
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CardPaymentRequest {
    private BigDecimal transactionAmount;
    private String cardHolderName;
    private String cardNumber;
    private Integer expirationMonth;
    private Integer expirationYear;
    private String cvv;
    private Long orderId;
}
