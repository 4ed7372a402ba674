package com.hhplus.checkout.domain.customer;

import jakarta.persistence.*;
import lombok.*;

/**
 * Customer 엔티티 (외부 협력 도메인)
 *
 * 결제 엔진은 존재 여부만 확인한다.
 */
@Entity
@Table(name = "customers")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Customer {
    @Id
    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "email")
    private String email;
}
