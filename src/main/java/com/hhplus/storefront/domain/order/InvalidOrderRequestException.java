package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 주문서 입력값(결제 수단, 배송지)이 유효하지 않을 때 발생하는 예외 (400)
 */
public class InvalidOrderRequestException extends DomainException {

    public InvalidOrderRequestException(String detail) {
        super(ErrorCode.ORDER_INVALID_REQUEST, detail);
    }
}
