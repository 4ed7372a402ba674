package com.hhplus.checkout.common.retry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * BoundedRetryExecutor - 제한 횟수 재시도 + 지수 백오프 정책
 *
 * 정책:
 * - 최대 maxAttempts 회 호출 (첫 호출 포함)
 * - 재시도 전 대기: baseDelay, baseDelay*2, baseDelay*4, ... (Jitter 없음, 상한 없음)
 * - 성공 판정(isSuccess)을 통과한 결과는 즉시 반환
 * - 실패 결과만 반복되면 마지막 실패 결과를 반환
 * - retryableExceptions 에 속한 예외는 마지막 시도가 아니면 재시도, 마지막 시도면 그대로 전파
 * - 그 외 예외는 재시도 없이 즉시 전파
 *
 * 내부적으로 Spring Retry의 RetryTemplate(SimpleRetryPolicy + ExponentialBackOffPolicy)을 사용한다.
 * Sleeper를 주입받으므로 테스트에서 대기 스케줄을 기록할 수 있다.
 */
@Slf4j
public class BoundedRetryExecutor {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final long baseDelayMs;
    private final RetryTemplate retryTemplate;

    public BoundedRetryExecutor(int maxAttempts,
                                long baseDelayMs,
                                Sleeper sleeper,
                                Collection<Class<? extends Throwable>> retryableExceptions) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts는 1 이상이어야 합니다: " + maxAttempts);
        }
        if (baseDelayMs < 1) {
            throw new IllegalArgumentException("baseDelayMs는 1 이상이어야 합니다: " + baseDelayMs);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.retryTemplate = buildTemplate(sleeper, retryableExceptions);
    }

    /**
     * 재시도 정책을 적용하여 attempt 를 실행한다.
     *
     * @param operation 로그용 작업 이름
     * @param attempt 한 번의 호출
     * @param isSuccess 결과 성공 판정
     * @return 첫 번째 성공 결과, 또는 모든 시도가 실패했을 때 마지막 실패 결과
     */
    @SuppressWarnings("unchecked")
    public <T> T execute(String operation, Supplier<T> attempt, Predicate<T> isSuccess) {
        RetryCallback<T, RuntimeException> callback = context -> {
            int attemptNo = context.getRetryCount() + 1;
            T result = attempt.get();
            if (isSuccess.test(result)) {
                if (attemptNo > 1) {
                    log.info("[BoundedRetryExecutor] {} 성공 - attempt={}/{}", operation, attemptNo, maxAttempts);
                }
                return result;
            }
            throw new UnsuccessfulAttemptException(result);
        };

        try {
            return retryTemplate.execute(callback);
        } catch (UnsuccessfulAttemptException e) {
            log.warn("[BoundedRetryExecutor] {} 모든 시도 실패 - attempts={}", operation, maxAttempts);
            return (T) e.getResult();
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    private RetryTemplate buildTemplate(Sleeper sleeper, Collection<Class<? extends Throwable>> retryableExceptions) {
        Map<Class<? extends Throwable>, Boolean> retryable = new HashMap<>();
        retryable.put(UnsuccessfulAttemptException.class, true);
        for (Class<? extends Throwable> type : retryableExceptions) {
            retryable.put(type, true);
        }

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(baseDelayMs);
        backOffPolicy.setMultiplier(BACKOFF_MULTIPLIER);
        backOffPolicy.setMaxInterval(Long.MAX_VALUE);
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(maxAttempts, retryable, true));
        template.setBackOffPolicy(backOffPolicy);
        template.registerListener(new AttemptLoggingListener());
        return template;
    }

    /**
     * 성공 판정을 통과하지 못한 결과를 재시도 대상으로 만들기 위한 내부 신호
     */
    private static final class UnsuccessfulAttemptException extends RuntimeException {

        private final transient Object result;

        private UnsuccessfulAttemptException(Object result) {
            super("unsuccessful attempt", null, false, false);
            this.result = result;
        }

        private Object getResult() {
            return result;
        }
    }

    private final class AttemptLoggingListener implements RetryListener {

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            int attemptNo = context.getRetryCount();
            if (throwable instanceof UnsuccessfulAttemptException) {
                log.info("[BoundedRetryExecutor] 시도 실패 - attempt={}/{}", attemptNo, maxAttempts);
            } else {
                log.warn("[BoundedRetryExecutor] 시도 중 예외 - attempt={}/{}, error={}",
                        attemptNo, maxAttempts, throwable.getMessage());
            }
        }
    }
}
