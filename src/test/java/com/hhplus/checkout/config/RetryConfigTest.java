package com.hhplus.checkout.config;

import com.hhplus.checkout.common.retry.BoundedRetryExecutor;
import com.hhplus.checkout.domain.payment.GatewayTransportException;
import com.hhplus.checkout.infrastructure.constants.RetryConstants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryConfig 단위 테스트
 * - payment.gateway.* 설정이 게이트웨이 재시도 실행기에 그대로 반영되는지 확인
 */
@DisplayName("RetryConfig 단위 테스트")
class RetryConfigTest {

    private final RetryConfig retryConfig = new RetryConfig();

    private PaymentProperties properties(int maxRetries, long baseDelayMs) {
        return new PaymentProperties("http://localhost:5000/api", maxRetries, baseDelayMs, 2000, 5000,
                RetryConstants.BANK_INVOICE_VALIDITY_DAYS);
    }

    @Test
    @DisplayName("기본 설정 - 최대 3회, 기본 대기 1000ms")
    void gatewayRetryExecutor_Defaults() {
        // When
        BoundedRetryExecutor executor = retryConfig.gatewayRetryExecutor(
                properties(RetryConstants.GATEWAY_MAX_RETRIES, RetryConstants.GATEWAY_BASE_DELAY_MS),
                retryConfig.retrySleeper());

        // Then
        assertEquals(3, executor.getMaxAttempts());
        assertEquals(1000L, executor.getBaseDelayMs());
    }

    @Test
    @DisplayName("설정 값 반영 - 전송 오류만 재시도하고 대기는 설정된 기본 값에서 두 배씩")
    void gatewayRetryExecutor_UsesConfiguredValues() {
        // Given
        List<Long> sleeps = new ArrayList<>();
        BoundedRetryExecutor executor = retryConfig.gatewayRetryExecutor(properties(4, 5L), sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        // When
        String result = executor.execute("card", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new GatewayTransportException("connection reset", null);
            }
            return "approved";
        }, "approved"::equals);

        // Then
        assertEquals(4, executor.getMaxAttempts());
        assertEquals(5L, executor.getBaseDelayMs());
        assertEquals("approved", result);
        assertEquals(3, calls.get());
        assertThat(sleeps).containsExactly(5L, 10L);
    }

    @Test
    @DisplayName("전송 오류가 아닌 예외는 재시도하지 않음")
    void gatewayRetryExecutor_OtherExceptionNotRetried() {
        // Given
        List<Long> sleeps = new ArrayList<>();
        BoundedRetryExecutor executor = retryConfig.gatewayRetryExecutor(properties(3, 5L), sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        // When & Then
        assertThrows(IllegalStateException.class, () -> executor.execute("card", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bad request");
        }, result -> true));
        assertEquals(1, calls.get());
        assertThat(sleeps).isEmpty();
    }
}
