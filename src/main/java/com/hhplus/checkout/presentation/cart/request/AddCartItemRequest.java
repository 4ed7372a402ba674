package com.hhplus.checkout.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 상품 담기 요청 DTO (quantity 생략 시 1)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {

    @JsonProperty("product_id")
    private Long productId;

    private Integer quantity;
}
