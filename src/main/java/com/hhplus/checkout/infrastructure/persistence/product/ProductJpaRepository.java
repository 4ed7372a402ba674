package com.hhplus.checkout.infrastructure.persistence.product;

import com.hhplus.checkout.domain.product.CatalogProduct;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CatalogProduct JPA Repository
 */
public interface ProductJpaRepository extends JpaRepository<CatalogProduct, Long> {
}
