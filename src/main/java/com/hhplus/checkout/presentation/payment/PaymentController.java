package com.hhplus.checkout.presentation.payment;

import com.hhplus.checkout.application.payment.PaymentService;
import com.hhplus.checkout.application.payment.dto.PaymentResult;
import com.hhplus.checkout.presentation.payment.mapper.PaymentMapper;
import com.hhplus.checkout.presentation.payment.request.PaymentRequest;
import com.hhplus.checkout.presentation.payment.response.PaymentMethodResponse;
import com.hhplus.checkout.presentation.payment.response.PaymentResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * PaymentController - Presentation 계층
 * 결제 API 요청 처리
 *
 * 결제 거절은 200 OK + success=false 로 응답한다 (예외가 아닌 정상 결과).
 */
@RestController
@RequestMapping("/orders")
public class PaymentController {

    private final PaymentService paymentService;
    private final PaymentMapper paymentMapper;

    public PaymentController(PaymentService paymentService, PaymentMapper paymentMapper) {
        this.paymentService = paymentService;
        this.paymentMapper = paymentMapper;
    }

    /**
     * GET /orders/payment-methods - 활성 결제 수단 목록
     */
    @GetMapping("/payment-methods")
    public ResponseEntity<List<PaymentMethodResponse>> getPaymentMethods() {
        List<PaymentMethodResponse> response = paymentService.getPaymentMethods().stream()
                .map(PaymentMethodResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(response);
    }

    /**
     * POST /orders/payment - 장바구니 결제
     */
    @PostMapping("/payment")
    public ResponseEntity<PaymentResponse> pay(
            @RequestHeader("X-USER-ID") Long customerId,
            @RequestBody PaymentRequest request) {
        PaymentResult result = paymentService.processPayment(customerId, paymentMapper.toCommand(request));
        return ResponseEntity.ok(paymentMapper.toResponse(result));
    }
}
