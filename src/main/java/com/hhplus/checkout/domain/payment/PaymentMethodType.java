package com.hhplus.checkout.domain.payment;

import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 결제 수단 코드
 *
 * - BANK: 인보이스 발행 후 비동기 정산
 * - TERMINAL: 게이트웨이 동기 결제 (단말기)
 * - CARD: 게이트웨이 동기 결제 (카드)
 */
@Getter
public enum PaymentMethodType {
    BANK("bank", PaymentStatus.PENDING),
    TERMINAL("terminal", PaymentStatus.PROCESSING),
    CARD("card", PaymentStatus.PROCESSING);

    private final String code;
    private final PaymentStatus initialStatus;

    PaymentMethodType(String code, PaymentStatus initialStatus) {
        this.code = code;
        this.initialStatus = initialStatus;
    }

    /**
     * 코드로 조회 (대소문자 무시)
     */
    public static Optional<PaymentMethodType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized))
                .findFirst();
    }
}
