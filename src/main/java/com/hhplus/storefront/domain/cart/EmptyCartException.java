package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 빈 장바구니로 주문을 시도할 때 발생하는 예외 (400)
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(Long userId) {
        super(ErrorCode.CART_EMPTY, "userId=" + userId);
    }
}
