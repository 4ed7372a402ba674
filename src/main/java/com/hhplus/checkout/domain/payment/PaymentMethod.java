package com.hhplus.checkout.domain.payment;

import jakarta.persistence.*;
import lombok.*;

/**
 * PaymentMethod 엔티티 (설정 데이터, 읽기 전용)
 *
 * 요청된 결제 수단이 현재 제공 중인지 확인하는 데에만 사용한다.
 */
@Entity
@Table(name = "payment_methods")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethod {
    @Id
    @Column(name = "code", length = 30)
    private String code;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "description")
    private String description;

    @Column(name = "image_url")
    private String imageUrl;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;
}
