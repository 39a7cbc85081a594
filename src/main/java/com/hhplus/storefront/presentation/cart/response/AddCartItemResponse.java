package com.hhplus.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 추가 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemResponse {
    private boolean success;

    @JsonProperty("cart_item_id")
    private Long cartItemId;

    @JsonProperty("item_type")
    private String itemType;

    @JsonProperty("item_id")
    private Long itemId;

    private Integer quantity;
}
