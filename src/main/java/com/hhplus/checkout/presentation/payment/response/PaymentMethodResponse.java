package com.hhplus.checkout.presentation.payment.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.payment.dto.PaymentMethodView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 수단 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethodResponse {

    private String code;

    private String title;

    private String description;

    @JsonProperty("image_url")
    private String imageUrl;

    @JsonProperty("display_order")
    private int displayOrder;

    public static PaymentMethodResponse from(PaymentMethodView view) {
        return PaymentMethodResponse.builder()
                .code(view.getCode())
                .title(view.getTitle())
                .description(view.getDescription())
                .imageUrl(view.getImageUrl())
                .displayOrder(view.getDisplayOrder())
                .build();
    }
}
