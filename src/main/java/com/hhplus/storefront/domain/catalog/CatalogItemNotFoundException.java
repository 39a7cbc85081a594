package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 카탈로그 상품을 찾을 수 없을 때 발생하는 예외 (404)
 *
 * 상품 상세 조회에서만 발생한다.
 * 장바구니 조회/주문 시에는 조회 실패 항목을 건너뛰고 예외로 올리지 않는다.
 */
public class CatalogItemNotFoundException extends DomainException {

    public CatalogItemNotFoundException(ItemType itemType, Long itemId) {
        super(ErrorCode.CATALOG_ITEM_NOT_FOUND, String.format("itemType=%s, itemId=%s", itemType.getCode(), itemId));
    }

    public CatalogItemNotFoundException(ItemRef itemRef) {
        this(itemRef.getItemType(), itemRef.getItemId());
    }
}
