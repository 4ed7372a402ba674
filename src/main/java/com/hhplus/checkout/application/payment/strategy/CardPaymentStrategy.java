package com.hhplus.checkout.application.payment.strategy;

import com.hhplus.checkout.application.payment.dto.CardDetails;
import com.hhplus.checkout.application.payment.dto.PaymentCommand;
import com.hhplus.checkout.domain.payment.CardPaymentRequest;
import com.hhplus.checkout.domain.payment.GatewayResponse;
import com.hhplus.checkout.domain.payment.InvalidPaymentRequestException;
import com.hhplus.checkout.domain.payment.PaymentGatewayClient;
import com.hhplus.checkout.domain.payment.PaymentMethodType;
import org.springframework.stereotype.Component;

/**
 * 카드 결제 - 게이트웨이 동기 결제
 *
 * 필수 정보: 카드 소유자, 카드 번호, 만료 월(1~12)/연도, CVV
 */
@Component
public class CardPaymentStrategy implements PaymentStrategy {

    private final PaymentGatewayClient paymentGatewayClient;

    public CardPaymentStrategy(PaymentGatewayClient paymentGatewayClient) {
        this.paymentGatewayClient = paymentGatewayClient;
    }

    @Override
    public PaymentMethodType getType() {
        return PaymentMethodType.CARD;
    }

    @Override
    public void validate(PaymentCommand command) {
        CardDetails card = command.getCard();
        if (card == null) {
            throw new InvalidPaymentRequestException("카드 정보가 필요합니다");
        }
        if (isBlank(card.getHolderName()) || isBlank(card.getCardNumber()) || isBlank(card.getCvv())) {
            throw new InvalidPaymentRequestException("카드 소유자, 카드 번호, CVV는 필수입니다");
        }
        Integer month = card.getExpirationMonth();
        if (month == null || month < 1 || month > 12 || card.getExpirationYear() == null) {
            throw new InvalidPaymentRequestException("카드 만료 월/연도가 올바르지 않습니다");
        }
    }

    @Override
    public SettlementOutcome settle(PaymentContext context) {
        CardDetails card = context.getCommand().getCard();
        CardPaymentRequest request = CardPaymentRequest.builder()
                .transactionAmount(context.getAmount())
                .cardHolderName(card.getHolderName())
                .cardNumber(card.getCardNumber())
                .expirationMonth(card.getExpirationMonth())
                .expirationYear(card.getExpirationYear())
                .cvv(card.getCvv())
                .orderId(context.getOrderId())
                .build();

        GatewayResponse response = paymentGatewayClient.payByCard(request, context.getIdempotencyKey());
        return response.isApproved()
                ? SettlementOutcome.approved(response.getExternalTransactionId())
                : SettlementOutcome.declined(response.getReason());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
