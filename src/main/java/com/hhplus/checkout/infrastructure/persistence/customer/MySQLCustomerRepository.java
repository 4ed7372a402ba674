package com.hhplus.checkout.infrastructure.persistence.customer;

import com.hhplus.checkout.domain.customer.Customer;
import com.hhplus.checkout.domain.customer.CustomerRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 Customer Repository 구현
 */
@Repository
public class MySQLCustomerRepository implements CustomerRepository {

    private final CustomerJpaRepository customerJpaRepository;

    public MySQLCustomerRepository(CustomerJpaRepository customerJpaRepository) {
        this.customerJpaRepository = customerJpaRepository;
    }

    @Override
    public boolean existsById(Long customerId) {
        return customerId != null && customerJpaRepository.existsById(customerId);
    }

    @Override
    public Optional<Customer> findById(Long customerId) {
        return customerJpaRepository.findById(customerId);
    }
}
