package com.hhplus.checkout.application.payment;

import com.hhplus.checkout.application.payment.dto.PaymentCommand;
import com.hhplus.checkout.application.payment.dto.PaymentMethodView;
import com.hhplus.checkout.application.payment.dto.PaymentReceipt;
import com.hhplus.checkout.application.payment.dto.PaymentResult;
import com.hhplus.checkout.application.payment.strategy.PaymentContext;
import com.hhplus.checkout.application.payment.strategy.PaymentStrategy;
import com.hhplus.checkout.application.payment.strategy.SettlementOutcome;
import com.hhplus.checkout.domain.customer.CustomerNotFoundException;
import com.hhplus.checkout.domain.customer.CustomerRepository;
import com.hhplus.checkout.domain.order.EmptyCartException;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.payment.GatewayTransportException;
import com.hhplus.checkout.domain.payment.PaymentGatewayUnavailableException;
import com.hhplus.checkout.domain.payment.PaymentMethodRepository;
import com.hhplus.checkout.domain.payment.PaymentMethodType;
import com.hhplus.checkout.domain.payment.PaymentTransaction;
import com.hhplus.checkout.domain.payment.UnsupportedPaymentMethodException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * PaymentService - 결제 오케스트레이터
 *
 * 처리 흐름:
 * 1. 검증 (상태 변경/외부 호출 없음)
 *    고객 존재 → 활성 결제 수단 → 수단별 요청 정보 → 활성 장바구니 → 빈 장바구니
 * 2. 결제 시작 (OPEN → CHECKOUT, 원장 행 추가, 금액 스냅샷)
 * 3. 결제 수단 전략 실행 (트랜잭션 밖)
 * 4. 결과 반영
 *    - PENDING(은행): 주문 CHECKOUT 유지, 인보이스 반환
 *    - APPROVED: 원장 COMPLETED, 주문 PAID
 *    - DECLINED: 원장 FAILED, 주문 CANCELLED (예외가 아닌 실패 결과 반환)
 *    - 마지막 시도 전송 오류: 주문 CHECKOUT / 원장 PROCESSING 유지, PaymentGatewayUnavailableException
 */
@Slf4j
@Service
public class PaymentService {

    private final CustomerRepository customerRepository;
    private final OrderRepository orderRepository;
    private final PaymentMethodRepository paymentMethodRepository;
    private final PaymentTransactionService paymentTransactionService;
    private final Map<PaymentMethodType, PaymentStrategy> strategies;
    private final Clock clock;

    public PaymentService(CustomerRepository customerRepository,
                          OrderRepository orderRepository,
                          PaymentMethodRepository paymentMethodRepository,
                          PaymentTransactionService paymentTransactionService,
                          List<PaymentStrategy> strategies,
                          Clock clock) {
        this.customerRepository = customerRepository;
        this.orderRepository = orderRepository;
        this.paymentMethodRepository = paymentMethodRepository;
        this.paymentTransactionService = paymentTransactionService;
        this.strategies = new EnumMap<>(PaymentMethodType.class);
        for (PaymentStrategy strategy : strategies) {
            this.strategies.put(strategy.getType(), strategy);
        }
        this.clock = clock;
    }

    /**
     * 결제 처리
     *
     * @param customerId 고객 ID
     * @param command 결제 수단 및 수단별 정보
     * @return 결제 결과 (거절도 정상 결과로 반환)
     */
    public PaymentResult processPayment(Long customerId, PaymentCommand command) {
        // 1. 검증
        if (!customerRepository.existsById(customerId)) {
            throw new CustomerNotFoundException(customerId);
        }
        PaymentStrategy strategy = resolveStrategy(command.getMethod());
        strategy.validate(command);

        Order cart = orderRepository.findOpenByCustomerId(customerId)
                .orElseThrow(() -> EmptyCartException.noActiveCart(customerId));
        if (orderRepository.findLinesByOrderId(cart.getOrderId()).isEmpty()) {
            throw EmptyCartException.cartIsEmpty(cart.getOrderId());
        }

        // 2. 결제 시작
        LocalDateTime startedAt = LocalDateTime.now(clock);
        PaymentMethodType method = strategy.getType();
        PaymentTransaction transaction = paymentTransactionService.beginCheckout(cart, method, startedAt);

        PaymentContext context = PaymentContext.builder()
                .customerId(customerId)
                .orderId(cart.getOrderId())
                .transactionId(transaction.getTransactionId())
                .amount(transaction.getAmount())
                .idempotencyKey(transaction.getIdempotencyKey())
                .startedAt(startedAt)
                .command(command)
                .build();

        // 3. 전략 실행
        SettlementOutcome outcome;
        try {
            outcome = strategy.settle(context);
        } catch (GatewayTransportException e) {
            paymentTransactionService.markGatewayUnknown(transaction.getTransactionId(), e.getMessage());
            throw new PaymentGatewayUnavailableException(cart.getOrderId(), transaction.getTransactionId(), e);
        }

        // 4. 결과 반영
        return applyOutcome(context, method, outcome);
    }

    /**
     * 활성 결제 수단 목록 (displayOrder 순)
     * 전략이 등록되지 않은 수단은 제외
     */
    public List<PaymentMethodView> getPaymentMethods() {
        return paymentMethodRepository.findAllActive().stream()
                .filter(method -> PaymentMethodType.fromCode(method.getCode())
                        .map(strategies::containsKey)
                        .orElse(false))
                .map(PaymentMethodView::from)
                .collect(Collectors.toList());
    }

    private PaymentStrategy resolveStrategy(String methodCode) {
        if (paymentMethodRepository.findActiveByCode(methodCode).isEmpty()) {
            throw new UnsupportedPaymentMethodException(methodCode);
        }
        return PaymentMethodType.fromCode(methodCode)
                .map(strategies::get)
                .orElseThrow(() -> new UnsupportedPaymentMethodException(methodCode));
    }

    private PaymentResult applyOutcome(PaymentContext context, PaymentMethodType method, SettlementOutcome outcome) {
        LocalDateTime now = LocalDateTime.now(clock);
        switch (outcome.getKind()) {
            case PENDING:
                return PaymentResult.builder()
                        .success(true)
                        .method(method.getCode())
                        .message("인보이스가 발행되었습니다. 송금 확인 후 주문이 확정됩니다")
                        .orderId(context.getOrderId())
                        .transactionId(context.getTransactionId())
                        .data(outcome.getDocument())
                        .build();
            case APPROVED:
                PaymentTransaction completed = paymentTransactionService.completePayment(
                        context.getTransactionId(), outcome.getExternalTransactionId(), now);
                return PaymentResult.builder()
                        .success(true)
                        .method(method.getCode())
                        .message("결제가 완료되었습니다")
                        .orderId(context.getOrderId())
                        .transactionId(context.getTransactionId())
                        .data(PaymentReceipt.builder()
                                .customerId(context.getCustomerId())
                                .orderId(context.getOrderId())
                                .paymentDate(completed.getProcessedAt())
                                .amount(completed.getAmount())
                                .externalTransactionId(completed.getExternalTransactionId())
                                .build())
                        .build();
            case DECLINED:
            default:
                paymentTransactionService.failPayment(context.getTransactionId(), outcome.getReason(), now);
                log.info("[PaymentService] 결제 거절로 주문 취소 - customerId={}, orderId={}, method={}",
                        context.getCustomerId(), context.getOrderId(), method.getCode());
                return PaymentResult.builder()
                        .success(false)
                        .method(method.getCode())
                        .message("결제가 거절되었습니다")
                        .orderId(context.getOrderId())
                        .transactionId(context.getTransactionId())
                        .build();
        }
    }
}
