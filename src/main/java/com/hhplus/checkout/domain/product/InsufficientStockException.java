package com.hhplus.checkout.domain.product;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 재고가 부족할 때 발생하는 예외
 */
public class InsufficientStockException extends DomainException {

    public InsufficientStockException(Long productId, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                "productId=" + productId + ", requested=" + requested + ", available=" + available);
    }
}
