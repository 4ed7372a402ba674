package com.hhplus.checkout.domain.payment;

/**
 * 게이트웨이 전송 계층 오류 (연결 실패, 타임아웃 등)
 *
 * 마지막 시도가 아니면 재시도 대상이다.
 */
public class GatewayTransportException extends RuntimeException {

    public GatewayTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
