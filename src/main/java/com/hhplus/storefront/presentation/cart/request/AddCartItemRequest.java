package com.hhplus.storefront.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 추가 요청 DTO
 * quantity는 문자열/숫자 모두 받으며 검증은 서비스에서 한다. 생략 시 1.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {
    @JsonProperty("item_type")
    private String itemType;

    @JsonProperty("item_id")
    private Long itemId;

    @JsonProperty("quantity")
    private String quantity;
}
