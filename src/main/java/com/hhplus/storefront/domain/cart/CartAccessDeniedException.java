package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 다른 사용자의 장바구니 항목에 접근할 때 발생하는 예외 (403)
 */
public class CartAccessDeniedException extends DomainException {

    public CartAccessDeniedException(Long cartItemId, Long userId) {
        super(ErrorCode.CART_ACCESS_DENIED, String.format("cartItemId=%d, userId=%d", cartItemId, userId));
    }
}
