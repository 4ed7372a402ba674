package com.hhplus.checkout.domain.product;

import java.util.Optional;

/**
 * Product Repository Interface (Port)
 */
public interface ProductRepository {

    Optional<CatalogProduct> findById(Long productId);
}
