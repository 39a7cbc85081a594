package com.hhplus.storefront.application.cart.dto;

import com.hhplus.storefront.application.cart.PricedCartLine;
import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.catalog.CatalogItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 장바구니 화면의 한 줄 (상품명/사진/단가/금액 포함)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineResult {
    private Long cartItemId;
    private String itemType;
    private Long itemId;
    private String name;
    private String photo;
    private Long unitPrice;
    private Integer quantity;
    private Long lineTotal;
    private LocalDateTime addedAt;

    public static CartLineResult from(PricedCartLine line) {
        CartItem cartItem = line.getCartItem();
        CatalogItem catalogItem = line.getCatalogItem();
        return CartLineResult.builder()
                .cartItemId(cartItem.getCartItemId())
                .itemType(cartItem.getItemType().getCode())
                .itemId(cartItem.getItemId())
                .name(catalogItem.getName())
                .photo(catalogItem.getPhoto())
                .unitPrice(line.getUnitPrice())
                .quantity(cartItem.getQuantity())
                .lineTotal(line.getLineTotal())
                .addedAt(cartItem.getAddedAt())
                .build();
    }
}
