package com.hhplus.checkout.presentation.common;

import com.hhplus.checkout.common.exception.BizException;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.SystemException;
import com.hhplus.checkout.domain.payment.PaymentGatewayUnavailableException;
import com.hhplus.checkout.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_CART_EMPTY",
 *   "error_message": "장바구니가 비어 있습니다 | orderId=1",
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456"
 * }
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode 의 상태 코드 (400/403/404/409/503)
 * - 동시 변경 (낙관적 락, 유니크 제약): 409
 * - 요청 형식 오류: 400
 * - 그 외: 500
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e instanceof SystemException) {
            logger.error("[GlobalExceptionHandler] 시스템 예외 - code={}, message={}",
                    e.getErrorCodeValue(), e.getMessage(), e);
        } else {
            logger.warn("[GlobalExceptionHandler] 비즈니스 예외 - code={}, message={}",
                    e.getErrorCodeValue(), e.getMessage());
        }
        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 결제 결과 불명 (503)
     * 주문 CHECKOUT / 원장 PROCESSING 상태로 남아 있으므로 식별자를 함께 돌려준다.
     */
    @ExceptionHandler(PaymentGatewayUnavailableException.class)
    public ResponseEntity<ErrorResponse> handlePaymentGatewayUnavailable(PaymentGatewayUnavailableException e) {
        logger.error("[GlobalExceptionHandler] 결제 결과 불명 - orderId={}, transactionId={}",
                e.getOrderId(), e.getTransactionId(), e);
        ErrorResponse errorResponse = ErrorResponse.paymentUnknown(
                e.getErrorCodeValue(), e.getMessage(), e.getOrderId(), e.getTransactionId());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 장바구니 동시 변경 (409)
     * - 같은 고객의 OPEN 주문 동시 생성 (cart_owner_id 유니크 제약)
     * - 결제 시작과 장바구니 변경 경합 (@Version)
     */
    @ExceptionHandler({ObjectOptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleConcurrentModification(RuntimeException e) {
        logger.warn("[GlobalExceptionHandler] 동시 변경 충돌 - {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(ErrorCode.CART_CONFLICT));
    }

    @ExceptionHandler({MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        ErrorResponse errorResponse = ErrorResponse.of("INVALID_REQUEST", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 예상하지 못한 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        logger.error("[GlobalExceptionHandler] 예상하지 못한 오류", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR));
    }
}
