package com.hhplus.checkout.application.payment.invoice;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InvoiceGenerator 테스트")
class InvoiceGeneratorTest {

    private final InvoiceGenerator invoiceGenerator = new InvoiceGenerator();

    private BankInvoice invoice() {
        LocalDateTime createdAt = LocalDateTime.of(2024, 1, 10, 9, 0, 5);
        return BankInvoice.builder()
                .customerId(1L)
                .orderId(42L)
                .amount(new BigDecimal("30"))
                .createdAt(createdAt)
                .validUntil(createdAt.plusDays(30))
                .build();
    }

    @Test
    @DisplayName("같은 입력이면 바이트 단위로 같은 문서")
    void generate_Deterministic() {
        assertArrayEquals(invoiceGenerator.generate(invoice()), invoiceGenerator.generate(invoice()));
    }

    @Test
    @DisplayName("문서 내용 - 고객, 주문, UTC 시각, 금액")
    void generate_Content() {
        // When
        String document = new String(invoiceGenerator.generate(invoice()), StandardCharsets.UTF_8);

        // Then
        assertThat(document.split("\n")).startsWith(
                "BANK PAYMENT INVOICE",
                "====================",
                "",
                "Customer ID: 1",
                "Order ID: 42",
                "Creation Date: 2024-01-10 09:00:05 UTC",
                "Valid Until: 2024-02-09 09:00:05 UTC",
                "Amount: 30.00");
        assertTrue(document.endsWith("\n"));
        assertFalse(document.contains("\r"));
    }

    @Test
    @DisplayName("파일 이름은 invoice_{orderId}.txt")
    void fileName() {
        assertEquals("invoice_42.txt", invoice().getFileName());
    }
}
