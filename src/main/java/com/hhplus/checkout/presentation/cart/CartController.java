package com.hhplus.checkout.presentation.cart;

import com.hhplus.checkout.application.cart.CartService;
import com.hhplus.checkout.application.cart.dto.AddCartItemCommand;
import com.hhplus.checkout.presentation.cart.request.AddCartItemRequest;
import com.hhplus.checkout.presentation.cart.request.UpdateQuantityRequest;
import com.hhplus.checkout.presentation.cart.response.CartResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - Presentation 계층
 * 장바구니(OPEN 주문) API 요청 처리
 */
@RestController
@RequestMapping("/orders/cart")
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    /**
     * GET /orders/cart - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") Long customerId) {
        return ResponseEntity.ok(CartResponse.from(cartService.getCart(customerId)));
    }

    /**
     * POST /orders/cart/items - 상품 담기
     */
    @PostMapping("/items")
    public ResponseEntity<CartResponse> addItem(
            @RequestHeader("X-USER-ID") Long customerId,
            @RequestBody AddCartItemRequest request) {
        AddCartItemCommand command = AddCartItemCommand.builder()
                .productId(request.getProductId())
                .quantity(request.getQuantity())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CartResponse.from(cartService.addItem(customerId, command)));
    }

    /**
     * PUT /orders/cart/items/{product_id} - 수량 변경 (0 이하면 삭제)
     */
    @PutMapping("/items/{product_id}")
    public ResponseEntity<CartResponse> updateQuantity(
            @RequestHeader("X-USER-ID") Long customerId,
            @PathVariable("product_id") Long productId,
            @RequestBody UpdateQuantityRequest request) {
        int quantity = request.getQuantity() == null ? 0 : request.getQuantity();
        return ResponseEntity.ok(CartResponse.from(cartService.updateQuantity(customerId, productId, quantity)));
    }

    /**
     * DELETE /orders/cart/items/{product_id} - 상품 삭제
     */
    @DeleteMapping("/items/{product_id}")
    public ResponseEntity<CartResponse> removeItem(
            @RequestHeader("X-USER-ID") Long customerId,
            @PathVariable("product_id") Long productId) {
        return ResponseEntity.ok(CartResponse.from(cartService.removeItem(customerId, productId)));
    }

    /**
     * DELETE /orders/cart - 장바구니 비우기
     */
    @DeleteMapping
    public ResponseEntity<Void> clearCart(@RequestHeader("X-USER-ID") Long customerId) {
        cartService.clearCart(customerId);
        return ResponseEntity.noContent().build();
    }
}
