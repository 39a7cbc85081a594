package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 장바구니 항목을 찾을 수 없을 때 발생하는 예외
 */
public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(Long cartItemId) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, "cartItemId=" + cartItemId);
    }
}
