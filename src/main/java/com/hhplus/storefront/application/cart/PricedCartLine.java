package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.catalog.CatalogItem;
import lombok.Getter;

/**
 * 카탈로그 가격이 적용된 장바구니 한 줄
 */
@Getter
public class PricedCartLine {
    private final CartItem cartItem;
    private final CatalogItem catalogItem;
    private final long unitPrice;
    private final long lineTotal;

    PricedCartLine(CartItem cartItem, CatalogItem catalogItem) {
        this.cartItem = cartItem;
        this.catalogItem = catalogItem;
        this.unitPrice = catalogItem.getFinalPrice();
        this.lineTotal = catalogItem.priceFor(cartItem.getQuantity());
    }
}
