package com.hhplus.storefront.domain.catalog;

import java.util.List;
import java.util.Optional;

/**
 * CatalogItem Repository Interface (Domain Layer - Port)
 *
 * 상품 유형(테이블)마다 하나의 구현체가 존재하며,
 * CatalogLookup이 supportedType()으로 구현체를 선택한다.
 *
 * @param <T> 상품 엔티티 타입 (ServiceItem, MenuItem)
 */
public interface CatalogItemRepository<T extends CatalogItem> {

    /**
     * 이 저장소가 담당하는 상품 유형
     */
    ItemType supportedType();

    /**
     * ID로 상품 조회 (상태와 무관)
     */
    Optional<T> findById(Long itemId);

    /**
     * ACTIVE 상태의 상품 목록 조회
     */
    List<T> findAllActive();
}
