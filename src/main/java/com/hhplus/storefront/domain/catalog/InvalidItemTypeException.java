package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 알 수 없는 상품 유형일 때 발생하는 예외 (400)
 */
public class InvalidItemTypeException extends DomainException {

    public InvalidItemTypeException(String itemType) {
        super(ErrorCode.CATALOG_INVALID_ITEM_TYPE, "입력값: " + itemType);
    }
}
