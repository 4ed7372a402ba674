package com.hhplus.checkout.infrastructure.persistence.customer;

import com.hhplus.checkout.domain.customer.Customer;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Customer JPA Repository
 */
public interface CustomerJpaRepository extends JpaRepository<Customer, Long> {
}
