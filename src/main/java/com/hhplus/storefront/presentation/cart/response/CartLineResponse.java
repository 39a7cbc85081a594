package com.hhplus.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 장바구니 항목 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineResponse {

    @JsonProperty("cart_item_id")
    private Long cartItemId;

    @JsonProperty("item_type")
    private String itemType;

    @JsonProperty("item_id")
    private Long itemId;

    private String name;

    private String photo;

    @JsonProperty("unit_price")
    private Long unitPrice;

    private Integer quantity;

    @JsonProperty("line_total")
    private Long lineTotal;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("added_at")
    private LocalDateTime addedAt;
}
