package com.hhplus.storefront.domain.user;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 사용자 정보 입력값 오류
 */
public class InvalidUserRequestException extends DomainException {

    public InvalidUserRequestException(String detail) {
        super(ErrorCode.USER_INVALID_REQUEST, detail);
    }
}
