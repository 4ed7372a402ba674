package com.hhplus.checkout.application.payment.invoice;

import org.springframework.stereotype.Component;

import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;

/**
 * InvoiceGenerator - 은행 송금 인보이스 문서 생성
 *
 * 부수 효과가 없는 순수 함수. 입력(고객, 주문, 금액, 생성/만료 시각)이 같으면
 * 바이트 단위로 같은 문서를 만든다. 시각은 UTC 기준 yyyy-MM-dd HH:mm:ss.
 */
@Component
public class InvoiceGenerator {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String LINE_SEPARATOR = "\n";

    public byte[] generate(BankInvoice invoice) {
        StringBuilder document = new StringBuilder();
        appendLine(document, "BANK PAYMENT INVOICE");
        appendLine(document, "====================");
        appendLine(document, "");
        appendLine(document, "Customer ID: " + invoice.getCustomerId());
        appendLine(document, "Order ID: " + invoice.getOrderId());
        appendLine(document, "Creation Date: " + TIMESTAMP.format(invoice.getCreatedAt()) + " UTC");
        appendLine(document, "Valid Until: " + TIMESTAMP.format(invoice.getValidUntil()) + " UTC");
        appendLine(document, "Amount: " + invoice.getAmount().setScale(2, RoundingMode.HALF_UP).toPlainString());
        appendLine(document, "");
        appendLine(document, "Please transfer the amount above to complete your order.");
        appendLine(document, "Reference the Order ID in the transfer description.");
        return document.toString().getBytes(StandardCharsets.UTF_8);
    }

    private void appendLine(StringBuilder document, String line) {
        document.append(line).append(LINE_SEPARATOR);
    }
}
