package com.hhplus.storefront.domain.catalog;

/**
 * 카탈로그 상품 노출 상태
 * ACTIVE 상품만 목록에 노출되며, INACTIVE 상품도 ID 조회는 가능하다.
 */
public enum CatalogItemStatus {
    ACTIVE,
    INACTIVE
}
