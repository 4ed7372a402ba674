package com.hhplus.checkout.application.payment.dto;

import com.hhplus.checkout.domain.payment.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 수단 조회 결과
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethodView {
    private String code;
    private String title;
    private String description;
    private String imageUrl;
    private int displayOrder;

    public static PaymentMethodView from(PaymentMethod method) {
        return PaymentMethodView.builder()
                .code(method.getCode())
                .title(method.getTitle())
                .description(method.getDescription())
                .imageUrl(method.getImageUrl())
                .displayOrder(method.getDisplayOrder())
                .build();
    }
}
