package com.hhplus.checkout.application.payment.strategy;

import com.hhplus.checkout.domain.payment.GatewayResponse;
import com.hhplus.checkout.domain.payment.PaymentGatewayClient;
import com.hhplus.checkout.domain.payment.PaymentMethodType;
import com.hhplus.checkout.domain.payment.TerminalPaymentRequest;
import org.springframework.stereotype.Component;

/**
 * 단말기 결제 - 게이트웨이 동기 결제
 * accountNumber = 고객 ID, invoiceNumber = 주문 ID
 */
@Component
public class TerminalPaymentStrategy implements PaymentStrategy {

    private final PaymentGatewayClient paymentGatewayClient;

    public TerminalPaymentStrategy(PaymentGatewayClient paymentGatewayClient) {
        this.paymentGatewayClient = paymentGatewayClient;
    }

    @Override
    public PaymentMethodType getType() {
        return PaymentMethodType.TERMINAL;
    }

    @Override
    public SettlementOutcome settle(PaymentContext context) {
        TerminalPaymentRequest request = TerminalPaymentRequest.builder()
                .transactionAmount(context.getAmount())
                .accountNumber(String.valueOf(context.getCustomerId()))
                .invoiceNumber(String.valueOf(context.getOrderId()))
                .build();

        GatewayResponse response = paymentGatewayClient.payByTerminal(request, context.getIdempotencyKey());
        return response.isApproved()
                ? SettlementOutcome.approved(response.getExternalTransactionId())
                : SettlementOutcome.declined(response.getReason());
    }
}
