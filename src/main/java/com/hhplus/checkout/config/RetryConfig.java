package com.hhplus.checkout.config;

import com.hhplus.checkout.common.retry.BoundedRetryExecutor;
import com.hhplus.checkout.domain.payment.GatewayTransportException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.util.List;

/**
 * RetryConfig - 결제 게이트웨이 재시도 정책 설정
 *
 * 정책 (BoundedRetryExecutor):
 * - 최대 payment.gateway.max-retries 회 호출
 * - 대기: base-delay-ms × 2^(n-1), Jitter 없음
 * - GatewayTransportException 만 재시도 대상 (마지막 시도에서는 전파)
 *
 * 대기는 요청 스레드에서만 일어나며 다른 결제 요청은 막지 않는다.
 */
@Configuration
public class RetryConfig {

    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    public BoundedRetryExecutor gatewayRetryExecutor(PaymentProperties paymentProperties, Sleeper retrySleeper) {
        return new BoundedRetryExecutor(
                paymentProperties.getGatewayMaxRetries(),
                paymentProperties.getGatewayBaseDelayMs(),
                retrySleeper,
                List.of(GatewayTransportException.class));
    }
}
