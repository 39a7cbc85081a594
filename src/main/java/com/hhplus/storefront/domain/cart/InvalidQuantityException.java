package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 유효하지 않은 수량일 때 발생하는 예외
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(String rawQuantity, Throwable cause) {
        super(ErrorCode.CART_INVALID_QUANTITY, "입력값: " + rawQuantity);
        initCause(cause);
    }
}
