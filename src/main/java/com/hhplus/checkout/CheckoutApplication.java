package com.hhplus.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Checkout 애플리케이션 메인 클래스
 *
 * 장바구니 → 결제 → 주문 확정 흐름을 담당한다.
 * 재시도 정책은 RetryConfig 의 BoundedRetryExecutor(RetryTemplate 기반)로 적용한다.
 */
@SpringBootApplication
public class CheckoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(CheckoutApplication.class, args);
    }

}
