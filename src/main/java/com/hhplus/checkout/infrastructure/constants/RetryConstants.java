package com.hhplus.checkout.infrastructure.constants;

/**
 * RetryConstants - 결제 게이트웨이 재시도 기본값
 *
 * 지수 백오프(Exponential Backoff) 계산 방식:
 *
 * 재시도 횟수 | 딜레이 계산              | 실제 딜레이
 * ==============================================
 * 1회차      | 1000ms * (2^0) = 1000ms  | 1000ms
 * 2회차      | 1000ms * (2^1) = 2000ms  | 2000ms
 * 3회차      | 1000ms * (2^2) = 4000ms  | 4000ms
 *
 * 기본값(최대 3회 호출)에서는 1회차, 2회차 대기만 발생한다.
 * 모든 고객의 재시도가 같은 주기로 반복된다 (Jitter 없음, Circuit Breaker 없음).
 */
public class RetryConstants {

    /** 게이트웨이 호출 최대 시도 횟수 (첫 호출 포함) */
    public static final int GATEWAY_MAX_RETRIES = 3;

    /** 첫 재시도 전 대기 시간 (밀리초) */
    public static final long GATEWAY_BASE_DELAY_MS = 1000L;

    /** 은행 송금 인보이스 기본 유효 기간 (일) */
    public static final int BANK_INVOICE_VALIDITY_DAYS = 30;

    private RetryConstants() {
        throw new AssertionError("RetryConstants는 인스턴스화할 수 없습니다");
    }
}
