package com.hhplus.checkout.application.payment.strategy;

import com.hhplus.checkout.application.payment.dto.InvoiceDocument;
import com.hhplus.checkout.application.payment.invoice.BankInvoice;
import com.hhplus.checkout.application.payment.invoice.InvoiceGenerator;
import com.hhplus.checkout.config.PaymentProperties;
import com.hhplus.checkout.domain.payment.PaymentMethodType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 은행 송금 - 인보이스 발행 후 비동기 정산
 *
 * 주문은 CHECKOUT, 원장 행은 PENDING 으로 남는다.
 * validUntil = 시도 시각 + payment.bank-invoice-validity-days
 */
@Slf4j
@Component
public class BankTransferStrategy implements PaymentStrategy {

    private final InvoiceGenerator invoiceGenerator;
    private final PaymentProperties paymentProperties;

    public BankTransferStrategy(InvoiceGenerator invoiceGenerator, PaymentProperties paymentProperties) {
        this.invoiceGenerator = invoiceGenerator;
        this.paymentProperties = paymentProperties;
    }

    @Override
    public PaymentMethodType getType() {
        return PaymentMethodType.BANK;
    }

    @Override
    public SettlementOutcome settle(PaymentContext context) {
        LocalDateTime createdAt = context.getStartedAt();
        BankInvoice invoice = BankInvoice.builder()
                .customerId(context.getCustomerId())
                .orderId(context.getOrderId())
                .amount(context.getAmount())
                .createdAt(createdAt)
                .validUntil(createdAt.plusDays(paymentProperties.getBankInvoiceValidityDays()))
                .build();

        byte[] content = invoiceGenerator.generate(invoice);
        log.info("[BankTransferStrategy] 인보이스 발행 - orderId={}, amount={}, validUntil={}",
                invoice.getOrderId(), invoice.getAmount(), invoice.getValidUntil());

        return SettlementOutcome.pending(InvoiceDocument.builder()
                .fileName(invoice.getFileName())
                .content(content)
                .customerId(invoice.getCustomerId())
                .orderId(invoice.getOrderId())
                .amount(invoice.getAmount())
                .createdAt(invoice.getCreatedAt())
                .validUntil(invoice.getValidUntil())
                .build());
    }
}
