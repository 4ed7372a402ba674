package com.hhplus.checkout.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 에러 응답 DTO
 *
 * order_id / transaction_id 는 결제 결과를 알 수 없는 경우(503)에만 채워진다.
 * 클라이언트는 이 값으로 결제 상태를 다시 조회한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("transaction_id")
    private Long transactionId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    public static ErrorResponse of(String errorCode, String errorMessage) {
        return ErrorResponse.builder()
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .timestamp(Instant.now())
                .requestId(newRequestId())
                .build();
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return of(errorCode.getCode(), errorCode.getMessage());
    }

    /**
     * 결제 결과 불명 응답 (수동 확인용 식별자 포함)
     */
    public static ErrorResponse paymentUnknown(String errorCode, String errorMessage, Long orderId, Long transactionId) {
        return ErrorResponse.builder()
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .orderId(orderId)
                .transactionId(transactionId)
                .timestamp(Instant.now())
                .requestId(newRequestId())
                .build();
    }

    private static String newRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 12);
    }
}
