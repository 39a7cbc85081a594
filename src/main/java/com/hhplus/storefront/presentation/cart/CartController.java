package com.hhplus.storefront.presentation.cart;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.cart.dto.CartItemResult;
import com.hhplus.storefront.presentation.cart.mapper.CartMapper;
import com.hhplus.storefront.presentation.cart.request.AddCartItemRequest;
import com.hhplus.storefront.presentation.cart.response.AddCartItemResponse;
import com.hhplus.storefront.presentation.cart.response.CartResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리
 */
@RestController
@RequestMapping("/cart")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * GET /cart - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.getCart(userId)));
    }

    /**
     * POST /cart/items - 장바구니 상품 추가 (같은 상품이면 수량 누적)
     */
    @PostMapping("/items")
    public ResponseEntity<AddCartItemResponse> addCartItem(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody AddCartItemRequest request) {
        CartItemResult result = cartService.addItem(userId, cartMapper.toAddCartItemCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(cartMapper.toAddCartItemResponse(result));
    }

    /**
     * DELETE /cart/items/{cart_item_id} - 장바구니 항목 삭제
     */
    @DeleteMapping("/items/{cart_item_id}")
    public ResponseEntity<Void> removeCartItem(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("cart_item_id") Long cartItemId) {
        cartService.removeItem(userId, cartItemId);
        return ResponseEntity.noContent().build();
    }
}
