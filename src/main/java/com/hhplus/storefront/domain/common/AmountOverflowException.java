package com.hhplus.storefront.domain.common;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 항목 금액 또는 총액이 long 범위를 넘을 때 발생하는 예외
 */
public class AmountOverflowException extends DomainException {

    public AmountOverflowException(String detail, ArithmeticException cause) {
        super(ErrorCode.AMOUNT_OVERFLOW, detail);
        initCause(cause);
    }
}
