package com.hhplus.storefront.application.catalog;

import com.hhplus.storefront.application.catalog.dto.CatalogItemResult;
import com.hhplus.storefront.domain.catalog.CatalogItemNotFoundException;
import com.hhplus.storefront.domain.catalog.ItemRef;
import com.hhplus.storefront.domain.catalog.ItemType;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * CatalogService - Application 계층
 * 상품 목록/상세 조회
 */
@Service
@Transactional(readOnly = true)
public class CatalogService {

    private final CatalogLookup catalogLookup;

    public CatalogService(CatalogLookup catalogLookup) {
        this.catalogLookup = catalogLookup;
    }

    /**
     * 유형별 판매 중(ACTIVE) 상품 목록 조회
     *
     * @param itemType 상품 유형 문자열 ("service" | "menu")
     */
    public List<CatalogItemResult> listActiveItems(String itemType) {
        ItemType type = ItemType.from(itemType);
        return catalogLookup.listActive(type).stream()
                .map(CatalogItemResult::from)
                .collect(Collectors.toList());
    }

    /**
     * 상품 상세 조회 (상태 무관)
     *
     * @throws CatalogItemNotFoundException 상품이 없는 경우
     */
    public CatalogItemResult getItemDetail(String itemType, Long itemId) {
        ItemType type = ItemType.from(itemType);
        if (itemId == null || itemId < 1) {
            throw new CatalogItemNotFoundException(type, itemId);
        }
        return CatalogItemResult.from(catalogLookup.getItem(ItemRef.of(type, itemId)));
    }
}
