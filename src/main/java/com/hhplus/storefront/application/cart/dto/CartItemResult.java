package com.hhplus.storefront.application.cart.dto;

import com.hhplus.storefront.domain.cart.CartItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 추가 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResult {
    private Long cartItemId;
    private String itemType;
    private Long itemId;
    private Integer quantity;

    public static CartItemResult from(CartItem cartItem) {
        return CartItemResult.builder()
                .cartItemId(cartItem.getCartItemId())
                .itemType(cartItem.getItemType().getCode())
                .itemId(cartItem.getItemId())
                .quantity(cartItem.getQuantity())
                .build();
    }
}
