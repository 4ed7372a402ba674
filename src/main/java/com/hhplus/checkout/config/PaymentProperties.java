package com.hhplus.checkout.config;

import com.hhplus.checkout.infrastructure.constants.RetryConstants;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 결제 관련 설정 값 (application.yml의 payment.*)
 *
 * payment:
 *   bank-invoice-validity-days: 30
 *   gateway:
 *     base-url: http://localhost:5000/api
 *     max-retries: 3
 *     base-delay-ms: 1000
 *     connect-timeout-ms: 2000
 *     read-timeout-ms: 5000
 */
@Getter
@Component
public class PaymentProperties {

    private final String gatewayBaseUrl;
    private final int gatewayMaxRetries;
    private final long gatewayBaseDelayMs;
    private final int gatewayConnectTimeoutMs;
    private final int gatewayReadTimeoutMs;
    private final int bankInvoiceValidityDays;

    public PaymentProperties(
            @Value("${payment.gateway.base-url}") String gatewayBaseUrl,
            @Value("${payment.gateway.max-retries:" + RetryConstants.GATEWAY_MAX_RETRIES + "}") int gatewayMaxRetries,
            @Value("${payment.gateway.base-delay-ms:" + RetryConstants.GATEWAY_BASE_DELAY_MS + "}") long gatewayBaseDelayMs,
            @Value("${payment.gateway.connect-timeout-ms:2000}") int gatewayConnectTimeoutMs,
            @Value("${payment.gateway.read-timeout-ms:5000}") int gatewayReadTimeoutMs,
            @Value("${payment.bank-invoice-validity-days:" + RetryConstants.BANK_INVOICE_VALIDITY_DAYS + "}") int bankInvoiceValidityDays) {
        if (bankInvoiceValidityDays < 1) {
            throw new IllegalArgumentException("payment.bank-invoice-validity-days는 1 이상이어야 합니다");
        }
        this.gatewayBaseUrl = gatewayBaseUrl;
        this.gatewayMaxRetries = gatewayMaxRetries;
        this.gatewayBaseDelayMs = gatewayBaseDelayMs;
        this.gatewayConnectTimeoutMs = gatewayConnectTimeoutMs;
        this.gatewayReadTimeoutMs = gatewayReadTimeoutMs;
        this.bankInvoiceValidityDays = bankInvoiceValidityDays;
    }
}
