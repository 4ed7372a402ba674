package com.hhplus.checkout.presentation.payment.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 카드 정보 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CardDetailsRequest {

    @JsonProperty("holder_name")
    private String holderName;

    @JsonProperty("card_number")
    private String cardNumber;

    @JsonProperty("expiration_month")
    private Integer expirationMonth;

    @JsonProperty("expiration_year")
    private Integer expirationYear;

    private String cvv;
}
