package com.hhplus.storefront.domain.user;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 이미 등록된 휴대폰 번호 또는 이메일로 가입/수정하려 할 때 발생하는 예외
 */
public class DuplicateUserException extends DomainException {

    public DuplicateUserException(String field) {
        super(ErrorCode.USER_DUPLICATE, "field=" + field);
    }

    public DuplicateUserException(String field, Throwable cause) {
        this(field);
        initCause(cause);
    }
}
