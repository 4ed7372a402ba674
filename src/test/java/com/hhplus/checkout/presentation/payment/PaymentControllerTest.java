package com.hhplus.checkout.presentation.payment;

import com.hhplus.checkout.application.payment.PaymentService;
import com.hhplus.checkout.application.payment.dto.CardDetails;
import com.hhplus.checkout.application.payment.dto.InvoiceDocument;
import com.hhplus.checkout.application.payment.dto.PaymentCommand;
import com.hhplus.checkout.application.payment.dto.PaymentMethodView;
import com.hhplus.checkout.application.payment.dto.PaymentResult;
import com.hhplus.checkout.domain.order.EmptyCartException;
import com.hhplus.checkout.domain.order.OrderConflictException;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.domain.payment.PaymentGatewayUnavailableException;
import com.hhplus.checkout.presentation.common.GlobalExceptionHandler;
import com.hhplus.checkout.presentation.payment.mapper.PaymentMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * PaymentController 단위 테스트
 * - MockMvc standalone + GlobalExceptionHandler 로 HTTP 매핑 검증
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentController 단위 테스트")
class PaymentControllerTest {

    private static final String CARD_BODY = "{\"method\":\"card\",\"card\":{\"holder_name\":\"HONG GILDONG\","
            + "\"card_number\":\"4111111111111111\",\"expiration_month\":12,\"expiration_year\":2030,\"cvv\":\"123\"}}";

    @Mock
    private PaymentService paymentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PaymentController(paymentService, new PaymentMapper()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("결제 수단 목록 조회")
    void getPaymentMethods() throws Exception {
        // Given
        when(paymentService.getPaymentMethods()).thenReturn(List.of(
                PaymentMethodView.builder().code("bank").title("Bank").displayOrder(1).build(),
                PaymentMethodView.builder().code("card").title("Visa").displayOrder(3).build()));

        // When & Then
        mockMvc.perform(get("/orders/payment-methods"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].code").value("bank"));
    }

    @Test
    @DisplayName("카드 결제 요청 - 요청 본문이 커맨드로 변환됨")
    void pay_Card() throws Exception {
        // Given
        when(paymentService.processPayment(eq(1L), any(PaymentCommand.class))).thenReturn(PaymentResult.builder()
                .success(true).method("card").message("결제가 완료되었습니다").orderId(10L).transactionId(20L).build());

        // When
        mockMvc.perform(post("/orders/payment")
                        .header("X-USER-ID", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.order_id").value(10))
                .andExpect(jsonPath("$.transaction_id").value(20));

        // Then
        ArgumentCaptor<PaymentCommand> captor = ArgumentCaptor.forClass(PaymentCommand.class);
        verify(paymentService).processPayment(eq(1L), captor.capture());
        CardDetails card = captor.getValue().getCard();
        assertEquals("card", captor.getValue().getMethod());
        assertEquals("HONG GILDONG", card.getHolderName());
        assertEquals(12, card.getExpirationMonth());
    }

    @Test
    @DisplayName("결제 거절 - 200 OK + success=false")
    void pay_Declined() throws Exception {
        when(paymentService.processPayment(eq(1L), any(PaymentCommand.class))).thenReturn(PaymentResult.builder()
                .success(false).method("terminal").message("결제가 거절되었습니다").orderId(10L).transactionId(20L).build());

        mockMvc.perform(post("/orders/payment")
                        .header("X-USER-ID", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"terminal\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    @DisplayName("은행 송금 - 인보이스 반환")
    void pay_BankInvoice() throws Exception {
        LocalDateTime createdAt = LocalDateTime.of(2024, 1, 10, 9, 0);
        when(paymentService.processPayment(eq(1L), any(PaymentCommand.class))).thenReturn(PaymentResult.builder()
                .success(true).method("bank").orderId(10L).transactionId(20L)
                .data(InvoiceDocument.builder()
                        .fileName("invoice_10.txt")
                        .content(new byte[]{'A'})
                        .customerId(1L)
                        .orderId(10L)
                        .amount(new BigDecimal("30.00"))
                        .createdAt(createdAt)
                        .validUntil(createdAt.plusDays(30))
                        .build())
                .build());

        mockMvc.perform(post("/orders/payment")
                        .header("X-USER-ID", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"bank\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.file_name").value("invoice_10.txt"))
                .andExpect(jsonPath("$.data.amount").value(30.00));
    }

    @Test
    @DisplayName("빈 장바구니 - 400")
    void pay_EmptyCart() throws Exception {
        when(paymentService.processPayment(eq(1L), any(PaymentCommand.class)))
                .thenThrow(EmptyCartException.cartIsEmpty(10L));

        mockMvc.perform(post("/orders/payment")
                        .header("X-USER-ID", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"bank\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CART_EMPTY"))
                .andExpect(jsonPath("$.transaction_id").doesNotExist());
    }

    @Test
    @DisplayName("동시 결제 충돌 - 409")
    void pay_Conflict() throws Exception {
        when(paymentService.processPayment(eq(1L), any(PaymentCommand.class)))
                .thenThrow(new OrderConflictException(10L, OrderStatus.OPEN));

        mockMvc.perform(post("/orders/payment")
                        .header("X-USER-ID", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("APP_ORDER_CHECKOUT_CONFLICT"));
    }

    @Test
    @DisplayName("게이트웨이 결과 불명 - 503")
    void pay_GatewayUnavailable() throws Exception {
        when(paymentService.processPayment(eq(1L), any(PaymentCommand.class)))
                .thenThrow(new PaymentGatewayUnavailableException(10L, 20L, new IOException("timeout")));

        mockMvc.perform(post("/orders/payment")
                        .header("X-USER-ID", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("SYSTEM_PAYMENT_GATEWAY_UNAVAILABLE"))
                .andExpect(jsonPath("$.order_id").value(10))
                .andExpect(jsonPath("$.transaction_id").value(20));
    }

    @Test
    @DisplayName("X-USER-ID 헤더 누락 - 400, 서비스 호출 없음")
    void pay_MissingHeader() throws Exception {
        mockMvc.perform(post("/orders/payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));

        verifyNoInteractions(paymentService);
    }
}
