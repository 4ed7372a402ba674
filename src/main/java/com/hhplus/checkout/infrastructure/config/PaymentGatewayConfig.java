package com.hhplus.checkout.infrastructure.config;

import com.hhplus.checkout.config.PaymentProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * 결제 게이트웨이 RestClient 설정
 *
 * - Base URL: payment.gateway.base-url
 * - 연결/읽기 타임아웃: payment.gateway.connect-timeout-ms / read-timeout-ms
 *   (타임아웃은 전송 오류로 취급되어 재시도 대상)
 */
@Configuration
public class PaymentGatewayConfig {

    @Bean
    public RestClient paymentGatewayRestClient(RestClient.Builder builder, PaymentProperties paymentProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(paymentProperties.getGatewayConnectTimeoutMs());
        requestFactory.setReadTimeout(paymentProperties.getGatewayReadTimeoutMs());

        return builder
                .baseUrl(paymentProperties.getGatewayBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
