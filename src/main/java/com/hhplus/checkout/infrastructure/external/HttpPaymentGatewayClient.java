package com.hhplus.checkout.infrastructure.external;

import com.hhplus.checkout.common.retry.BoundedRetryExecutor;
import com.hhplus.checkout.domain.payment.CardPaymentRequest;
import com.hhplus.checkout.domain.payment.GatewayResponse;
import com.hhplus.checkout.domain.payment.GatewayTransportException;
import com.hhplus.checkout.domain.payment.PaymentGatewayClient;
import com.hhplus.checkout.domain.payment.TerminalPaymentRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HttpPaymentGatewayClient - 외부 결제 게이트웨이 HTTP 클라이언트
 *
 * 역할:
 * - POST {base-url}/payments/card, POST {base-url}/payments/terminal
 * - Idempotency-Key 헤더로 결제 시도 식별 (재시도마다 같은 값)
 * - BoundedRetryExecutor 로 거절/전송 오류 재시도
 *
 * 응답 해석:
 * - 2xx: 승인 (본문의 transactionId 는 선택)
 * - 그 외 상태 코드: 거절 (재시도 대상)
 * - RestClientException (연결 실패, 타임아웃): GatewayTransportException
 */
@Slf4j
@Component
public class HttpPaymentGatewayClient implements PaymentGatewayClient {

    static final String CARD_PATH = "/payments/card";
    static final String TERMINAL_PATH = "/payments/terminal";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestClient restClient;
    private final BoundedRetryExecutor retryExecutor;

    public HttpPaymentGatewayClient(@Qualifier("paymentGatewayRestClient") RestClient restClient,
                                    @Qualifier("gatewayRetryExecutor") BoundedRetryExecutor retryExecutor) {
        this.restClient = restClient;
        this.retryExecutor = retryExecutor;
    }

    @Override
    public GatewayResponse payByCard(CardPaymentRequest request, String idempotencyKey) {
        log.info("[HttpPaymentGatewayClient] 카드 결제 요청 - orderId={}, amount={}, idempotencyKey={}",
                request.getOrderId(), request.getTransactionAmount(), idempotencyKey);
        return retryExecutor.execute("card-payment",
                () -> post(CARD_PATH, request, idempotencyKey),
                GatewayResponse::isApproved);
    }

    @Override
    public GatewayResponse payByTerminal(TerminalPaymentRequest request, String idempotencyKey) {
        log.info("[HttpPaymentGatewayClient] 단말기 결제 요청 - invoiceNumber={}, amount={}, idempotencyKey={}",
                request.getInvoiceNumber(), request.getTransactionAmount(), idempotencyKey);
        return retryExecutor.execute("terminal-payment",
                () -> post(TERMINAL_PATH, request, idempotencyKey),
                GatewayResponse::isApproved);
    }

    /**
     * 게이트웨이 단일 호출 (재시도 없음)
     */
    private GatewayResponse post(String path, Object body, String idempotencyKey) {
        try {
            return restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                    .body(body)
                    .exchange((req, res) -> {
                        if (!res.getStatusCode().is2xxSuccessful()) {
                            log.info("[HttpPaymentGatewayClient] 결제 거절 - path={}, status={}",
                                    path, res.getStatusCode().value());
                            return GatewayResponse.declined("HTTP " + res.getStatusCode().value());
                        }
                        return GatewayResponse.approved(readTransactionId(res));
                    });
        } catch (RestClientException e) {
            throw new GatewayTransportException("결제 게이트웨이 호출 실패: " + path, e);
        }
    }

    private String readTransactionId(RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse response) {
        try {
            GatewayApprovalBody body = response.bodyTo(GatewayApprovalBody.class);
            return body == null ? null : body.getTransactionId();
        } catch (RestClientException e) {
            // 승인 응답 본문은 선택 사항
            log.debug("[HttpPaymentGatewayClient] 승인 응답 본문 해석 불가 - {}", e.getMessage());
            return null;
        }
    }
}
