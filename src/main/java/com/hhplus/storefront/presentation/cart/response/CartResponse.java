package com.hhplus.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 조회 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    @JsonProperty("user_id")
    private Long userId;

    private List<CartLineResponse> items;

    @JsonProperty("total_items")
    private Integer totalItems;

    @JsonProperty("total_amount")
    private Long totalAmount;
}
