package com.hhplus.checkout.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 장바구니(OPEN) 및 확정 주문의 상태 관리
 * - 상태 전환은 OrderStateMachine 테이블을 통해서만 수행
 *
 * 핵심 비즈니스 규칙:
 * - 고객당 OPEN 주문은 최대 1개 (cart_owner_id 유니크 제약)
 * - cart_owner_id 는 OPEN 상태에서만 customer_id 와 같고, OPEN을 벗어나면 null
 * - finalized_at 은 PAID / CANCELLED 진입 시에만 설정
 * - OPEN 이 아닌 주문의 항목은 변경 불가
 *
 * 주문 금액은 컬럼으로 저장하지 않는다. 결제 시점마다 OrderCalculator로 다시 계산한다.
 */
@Entity
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uk_orders_cart_owner", columnNames = "cart_owner_id"),
        indexes = @Index(name = "idx_orders_customer", columnList = "customer_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    /**
     * OPEN 인 동안만 customerId, 그 외에는 null
     * MySQL/H2 유니크 인덱스는 NULL 중복을 허용한다.
     */
    @Column(name = "cart_owner_id")
    private Long cartOwnerId;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "finalized_at")
    private LocalDateTime finalizedAt;

    /**
     * 새 장바구니 생성 (정적 팩토리)
     */
    public static Order openCart(Long customerId, LocalDateTime now) {
        if (customerId == null) {
            throw new IllegalArgumentException("customerId는 필수입니다");
        }
        return Order.builder()
                .customerId(customerId)
                .status(OrderStatus.OPEN)
                .cartOwnerId(customerId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 이벤트 적용
     *
     * @throws InvalidOrderStatusException 허용되지 않은 전이
     */
    public void apply(OrderEvent event, LocalDateTime now) {
        OrderStatus next = OrderStateMachine.next(this.status, event);
        this.status = next;
        this.cartOwnerId = null;
        this.updatedAt = now;
        if (next.isTerminal()) {
            this.finalizedAt = now;
        }
    }

    /**
     * 장바구니 항목 변경 시 호출
     *
     * @throws OrderNotMutableException OPEN 상태가 아님
     */
    public void touch(LocalDateTime now) {
        assertMutable();
        this.updatedAt = now;
    }

    public void assertMutable() {
        if (this.status != OrderStatus.OPEN) {
            throw new OrderNotMutableException(this.orderId, this.status);
        }
    }

    public boolean isOpen() {
        return this.status == OrderStatus.OPEN;
    }

    public boolean isOwnedBy(Long customerId) {
        return this.customerId.equals(customerId);
    }
}
