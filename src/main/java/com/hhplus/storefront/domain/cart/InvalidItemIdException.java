package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 장바구니에 담으려는 상품 ID가 비었거나 1 미만일 때 발생하는 예외
 */
public class InvalidItemIdException extends DomainException {

    public InvalidItemIdException(Long itemId) {
        super(ErrorCode.CART_INVALID_ITEM_ID, "입력값: " + itemId);
    }
}
