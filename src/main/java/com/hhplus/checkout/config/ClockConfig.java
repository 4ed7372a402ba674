package com.hhplus.checkout.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시각 기준 설정
 *
 * 주문/원장 시각과 인보이스 시각은 모두 UTC 기준이다.
 * 테스트에서는 Clock.fixed 로 교체한다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
