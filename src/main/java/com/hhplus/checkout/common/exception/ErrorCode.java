package com.hhplus.checkout.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_CART_EMPTY, APP_ORDER_CHECKOUT_CONFLICT
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Customer Domain
    CUSTOMER_NOT_FOUND("DOMAIN_CUSTOMER_NOT_FOUND", "고객을 찾을 수 없습니다", 404),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 400),

    // Cart Domain
    NO_ACTIVE_CART("DOMAIN_CART_NOT_FOUND", "활성 장바구니가 없습니다", 400),
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),
    CART_LINE_NOT_FOUND("DOMAIN_CART_LINE_NOT_FOUND", "장바구니에 해당 상품이 없습니다", 404),
    INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "유효하지 않은 수량입니다", 400),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    INVALID_ORDER_STATUS("DOMAIN_ORDER_INVALID_STATUS", "유효하지 않은 주문 상태 전이입니다", 400),
    ORDER_NOT_MUTABLE("DOMAIN_ORDER_NOT_MUTABLE", "장바구니 상태가 아닌 주문은 변경할 수 없습니다", 400),
    CUSTOMER_MISMATCH("DOMAIN_ORDER_CUSTOMER_MISMATCH", "주문 고객이 일치하지 않습니다", 403),

    // Payment Domain
    UNSUPPORTED_PAYMENT_METHOD("DOMAIN_PAYMENT_UNSUPPORTED_METHOD", "지원하지 않는 결제 수단입니다", 400),
    INVALID_PAYMENT_REQUEST("DOMAIN_PAYMENT_INVALID_REQUEST", "결제 요청 정보가 올바르지 않습니다", 400),
    INVALID_TRANSACTION_STATUS("DOMAIN_PAYMENT_INVALID_TRANSACTION_STATUS", "이미 종결된 결제 트랜잭션입니다", 400),
    TRANSACTION_NOT_FOUND("DOMAIN_PAYMENT_TRANSACTION_NOT_FOUND", "결제 트랜잭션을 찾을 수 없습니다", 404),

    // ========== Application Layer Errors ==========

    ORDER_CHECKOUT_CONFLICT("APP_ORDER_CHECKOUT_CONFLICT", "이미 결제가 진행 중인 주문입니다", 409),
    CART_CONFLICT("APP_CART_CONFLICT", "장바구니가 동시에 변경되었습니다", 409),

    // ========== System Errors (5XX) ==========

    PAYMENT_GATEWAY_UNAVAILABLE("SYSTEM_PAYMENT_GATEWAY_UNAVAILABLE", "결제 게이트웨이 응답을 확인할 수 없습니다 - 수동 확인 필요", 503),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
