package com.hhplus.checkout.domain.customer;

import java.util.Optional;

/**
 * Customer Repository Interface (Port)
 */
public interface CustomerRepository {

    boolean existsById(Long customerId);

    Optional<Customer> findById(Long customerId);
}
