package com.hhplus.checkout.application.payment;

import com.hhplus.checkout.application.order.OrderCalculator;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderConflictException;
import com.hhplus.checkout.domain.order.OrderEvent;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.domain.payment.PaymentMethodType;
import com.hhplus.checkout.domain.payment.PaymentTransaction;
import com.hhplus.checkout.domain.payment.PaymentTransactionRepository;
import com.hhplus.checkout.domain.payment.TransactionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * PaymentTransactionService - 주문 상태와 결제 원장을 하나의 DB 트랜잭션으로 변경
 *
 * 역할:
 * - PaymentService(오케스트레이터)와 분리된 독립 서비스
 * - 게이트웨이 호출은 트랜잭션 밖(PaymentService)에서, 상태 변경만 여기서 수행
 * - @Transactional이 프록시를 통해 적용되도록 별도 빈으로 분리
 *
 * 아키텍처:
 * PaymentService (검증 → 전략 실행 → 결과 반영)
 *     ↓ (의존성 주입)
 * PaymentTransactionService (beginCheckout / completePayment / failPayment)
 */
@Service
public class PaymentTransactionService {

    private static final Logger log = LoggerFactory.getLogger(PaymentTransactionService.class);

    private final OrderRepository orderRepository;
    private final PaymentTransactionRepository paymentTransactionRepository;
    private final OrderCalculator orderCalculator;

    public PaymentTransactionService(OrderRepository orderRepository,
                                     PaymentTransactionRepository paymentTransactionRepository,
                                     OrderCalculator orderCalculator) {
        this.orderRepository = orderRepository;
        this.paymentTransactionRepository = paymentTransactionRepository;
        this.orderCalculator = orderCalculator;
    }

    /**
     * 결제 시작: OPEN → CHECKOUT + 원장 행 추가
     *
     * 동시성 제어:
     * - UPDATE ... WHERE status = 'OPEN' 으로 조건부 전환
     * - 0건 갱신이면 다른 요청이 먼저 결제를 시작한 것 → OrderConflictException (추가 변경 없음)
     *
     * 금액은 전환이 성공한 뒤 같은 트랜잭션에서 저장소의 최신 항목으로 계산한다.
     * CHECKOUT 이후에는 항목이 바뀌지 않으므로 스냅샷 금액과 실제 항목이 일치한다.
     *
     * @return 저장된 원장 행 (bank: PENDING, terminal/card: PROCESSING)
     */
    @Transactional
    public PaymentTransaction beginCheckout(Order order, PaymentMethodType method, LocalDateTime now) {
        boolean transitioned = orderRepository.transitionStatus(
                order.getOrderId(), OrderStatus.OPEN, OrderEvent.CHECKOUT_STARTED, now);
        if (!transitioned) {
            log.warn("[PaymentTransactionService] 결제 시작 충돌 - orderId={}, customerId={}",
                    order.getOrderId(), order.getCustomerId());
            throw new OrderConflictException(order.getOrderId(), OrderStatus.OPEN);
        }

        BigDecimal amount = orderCalculator.calculateOrderTotal(order.getOrderId());
        PaymentTransaction transaction = paymentTransactionRepository.save(PaymentTransaction.start(
                order.getOrderId(), order.getCustomerId(), method, amount, UUID.randomUUID().toString(), now));

        log.info("[PaymentTransactionService] 결제 시작 - orderId={}, transactionId={}, method={}, amount={}, status={}",
                order.getOrderId(), transaction.getTransactionId(), method.getCode(), amount, transaction.getStatus());
        return transaction;
    }

    /**
     * 결제 성공: 원장 COMPLETED + 주문 CHECKOUT → PAID
     */
    @Transactional
    public PaymentTransaction completePayment(Long transactionId, String externalTransactionId, LocalDateTime now) {
        PaymentTransaction transaction = getTransaction(transactionId);
        transaction.complete(externalTransactionId, now);
        paymentTransactionRepository.save(transaction);
        settleOrder(transaction.getOrderId(), OrderEvent.PAYMENT_SUCCEEDED, now);

        log.info("[PaymentTransactionService] 결제 완료 - orderId={}, transactionId={}, externalTransactionId={}",
                transaction.getOrderId(), transactionId, externalTransactionId);
        return transaction;
    }

    /**
     * 결제 실패: 원장 FAILED + 주문 CHECKOUT → CANCELLED
     */
    @Transactional
    public PaymentTransaction failPayment(Long transactionId, String reason, LocalDateTime now) {
        PaymentTransaction transaction = getTransaction(transactionId);
        transaction.fail(reason, now);
        paymentTransactionRepository.save(transaction);
        settleOrder(transaction.getOrderId(), OrderEvent.PAYMENT_FAILED, now);

        log.info("[PaymentTransactionService] 결제 실패 - orderId={}, transactionId={}, reason={}",
                transaction.getOrderId(), transactionId, reason);
        return transaction;
    }

    /**
     * 결과 불명 (마지막 시도 전송 오류)
     * 주문은 CHECKOUT, 원장은 PROCESSING 그대로 두고 오류 메시지만 기록한다.
     */
    @Transactional
    public void markGatewayUnknown(Long transactionId, String errorMessage) {
        PaymentTransaction transaction = getTransaction(transactionId);
        transaction.recordError(errorMessage);
        paymentTransactionRepository.save(transaction);

        log.error("[PaymentTransactionService] 게이트웨이 결과 불명 - 수동 확인 필요 orderId={}, transactionId={}, error={}",
                transaction.getOrderId(), transactionId, errorMessage);
    }

    private void settleOrder(Long orderId, OrderEvent event, LocalDateTime now) {
        if (!orderRepository.transitionStatus(orderId, OrderStatus.CHECKOUT, event, now)) {
            throw new OrderConflictException(orderId, OrderStatus.CHECKOUT);
        }
    }

    private PaymentTransaction getTransaction(Long transactionId) {
        return paymentTransactionRepository.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }
}
