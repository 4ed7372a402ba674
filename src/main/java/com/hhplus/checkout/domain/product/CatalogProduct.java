package com.hhplus.checkout.domain.product;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * CatalogProduct 엔티티 (외부 협력 도메인)
 *
 * 장바구니 담기 시점의 가격/할인율 스냅샷과 재고 확인에만 사용한다.
 * 카탈로그 CRUD는 이 서비스의 책임이 아니다.
 */
@Entity
@Table(name = "catalog_products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogProduct {
    @Id
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "discount_percent", nullable = false)
    private Integer discountPercent;

    @Column(name = "units_in_stock", nullable = false)
    private Integer unitsInStock;

    /**
     * 요청 수량만큼 재고가 있는지
     */
    public boolean hasStock(int quantity) {
        return unitsInStock != null && unitsInStock >= quantity;
    }
}
