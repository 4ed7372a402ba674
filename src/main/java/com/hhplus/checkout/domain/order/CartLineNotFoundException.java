package com.hhplus.checkout.domain.order;

import com.hhplus.checkout.common.exception.DomainException;
import com.hhplus.checkout.common.exception.ErrorCode;

/**
 * 장바구니에 해당 상품 항목이 없을 때 발생하는 예외
 */
public class CartLineNotFoundException extends DomainException {

    public CartLineNotFoundException(Long customerId, Long productId) {
        super(ErrorCode.CART_LINE_NOT_FOUND, "customerId=" + customerId + ", productId=" + productId);
    }
}
