package com.hhplus.checkout.presentation.payment.mapper;

import com.hhplus.checkout.application.payment.dto.CardDetails;
import com.hhplus.checkout.application.payment.dto.InvoiceDocument;
import com.hhplus.checkout.application.payment.dto.PaymentCommand;
import com.hhplus.checkout.application.payment.dto.PaymentReceipt;
import com.hhplus.checkout.application.payment.dto.PaymentResult;
import com.hhplus.checkout.presentation.payment.request.CardDetailsRequest;
import com.hhplus.checkout.presentation.payment.request.PaymentRequest;
import com.hhplus.checkout.presentation.payment.response.InvoiceResponse;
import com.hhplus.checkout.presentation.payment.response.PaymentResponse;
import com.hhplus.checkout.presentation.payment.response.ReceiptResponse;
import org.springframework.stereotype.Component;

/**
 * PaymentMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class PaymentMapper {

    public PaymentCommand toCommand(PaymentRequest request) {
        return PaymentCommand.builder()
                .method(request.getMethod())
                .card(toCardDetails(request.getCard()))
                .build();
    }

    public PaymentResponse toResponse(PaymentResult result) {
        return PaymentResponse.builder()
                .success(result.isSuccess())
                .method(result.getMethod())
                .message(result.getMessage())
                .orderId(result.getOrderId())
                .transactionId(result.getTransactionId())
                .data(toData(result.getData()))
                .build();
    }

    private CardDetails toCardDetails(CardDetailsRequest card) {
        if (card == null) {
            return null;
        }
        return CardDetails.builder()
                .holderName(card.getHolderName())
                .cardNumber(card.getCardNumber())
                .expirationMonth(card.getExpirationMonth())
                .expirationYear(card.getExpirationYear())
                .cvv(card.getCvv())
                .build();
    }

    private Object toData(Object data) {
        if (data instanceof InvoiceDocument) {
            InvoiceDocument invoice = (InvoiceDocument) data;
            return InvoiceResponse.builder()
                    .fileName(invoice.getFileName())
                    .content(invoice.getContent())
                    .customerId(invoice.getCustomerId())
                    .orderId(invoice.getOrderId())
                    .amount(invoice.getAmount())
                    .createdAt(invoice.getCreatedAt())
                    .validUntil(invoice.getValidUntil())
                    .build();
        }
        if (data instanceof PaymentReceipt) {
            PaymentReceipt receipt = (PaymentReceipt) data;
            return ReceiptResponse.builder()
                    .customerId(receipt.getCustomerId())
                    .orderId(receipt.getOrderId())
                    .paymentDate(receipt.getPaymentDate())
                    .amount(receipt.getAmount())
                    .externalTransactionId(receipt.getExternalTransactionId())
                    .build();
        }
        return null;
    }
}
