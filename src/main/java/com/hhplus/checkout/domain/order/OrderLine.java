package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.domain.product.CatalogProduct;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * OrderLine 도메인 엔티티
 *
 * 책임:
 * - 장바구니 내 상품 한 줄의 수량과 가격 스냅샷 관리
 * - 할인 적용 금액 계산
 *
 * 핵심 비즈니스 규칙:
 * - 수량은 1 이상 (0 이하로 변경하면 항목 삭제와 같다)
 * - 단가/할인율은 담는 시점의 카탈로그 값을 스냅샷으로 보존
 * - 할인율은 0 ~ 100
 */
@Entity
@Table(name = "order_lines",
        uniqueConstraints = @UniqueConstraint(name = "uk_order_lines_product", columnNames = {"order_id", "product_id"}))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLine {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_line_id")
    private Long orderLineId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "discount_percent", nullable = false)
    private Integer discountPercent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 스냅샷으로 항목 생성
     *
     * @param orderId 장바구니 주문 ID
     * @param product 담는 시점의 카탈로그 상품
     * @param quantity 수량 (1 이상)
     */
    public static OrderLine snapshotOf(Long orderId, CatalogProduct product, int quantity, LocalDateTime now) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }
        return of(orderId, product.getProductId(), quantity, product.getPrice(), product.getDiscountPercent(), now);
    }

    public static OrderLine of(Long orderId, Long productId, int quantity, BigDecimal unitPrice,
                               int discountPercent, LocalDateTime now) {
        if (discountPercent < 0 || discountPercent > 100) {
            throw new IllegalArgumentException("할인율은 0 ~ 100 이어야 합니다: " + discountPercent);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("단가는 0 이상이어야 합니다");
        }
        return OrderLine.builder()
                .orderId(orderId)
                .productId(productId)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .discountPercent(discountPercent)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 수량 변경 (1 이상만 허용, 0 이하는 호출 측에서 삭제 처리)
     */
    public void changeQuantity(int quantity, LocalDateTime now) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }
        this.quantity = quantity;
        this.updatedAt = now;
    }

    /**
     * 항목 금액 = 단가 × 수량 × (100 - 할인율) / 100
     * 반올림하지 않은 정확한 값을 반환한다. 반올림은 합계 단계에서 한 번만 한다.
     */
    public BigDecimal getLineTotal() {
        return unitPrice
                .multiply(BigDecimal.valueOf(quantity))
                .multiply(HUNDRED.subtract(BigDecimal.valueOf(discountPercent)))
                .movePointLeft(2);
    }
}
