package com.hhplus.checkout.infrastructure.persistence.product;

import com.hhplus.checkout.domain.product.CatalogProduct;
import com.hhplus.checkout.domain.product.ProductRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 카탈로그 상품 Repository 구현 (읽기 전용)
 */
@Repository
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public Optional<CatalogProduct> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }
}
