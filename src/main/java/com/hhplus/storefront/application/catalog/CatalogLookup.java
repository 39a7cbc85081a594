package com.hhplus.storefront.application.catalog;

import com.hhplus.storefront.domain.catalog.CatalogItem;
import com.hhplus.storefront.domain.catalog.CatalogItemNotFoundException;
import com.hhplus.storefront.domain.catalog.CatalogItemRepository;
import com.hhplus.storefront.domain.catalog.ItemRef;
import com.hhplus.storefront.domain.catalog.ItemType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CatalogLookup - 상품 참조 해석기 (Application 계층)
 *
 * 역할:
 * - ItemRef(유형 + ID)를 실제 상품으로 해석
 * - 유형별 CatalogItemRepository 구현체로 위임 (EnumMap 디스패치)
 *
 * 장바구니 조회, 주문 생성, 주문 내역 조회가 모두 이 컴포넌트를 통해 상품을 찾는다.
 * 상태 필터를 적용하지 않으므로 INACTIVE 상품도 해석된다.
 */
@Component
public class CatalogLookup {

    private final Map<ItemType, CatalogItemRepository<? extends CatalogItem>> repositories;

    public CatalogLookup(List<CatalogItemRepository<? extends CatalogItem>> repositoryList) {
        Map<ItemType, CatalogItemRepository<? extends CatalogItem>> byType = new EnumMap<>(ItemType.class);
        for (CatalogItemRepository<? extends CatalogItem> repository : repositoryList) {
            CatalogItemRepository<? extends CatalogItem> previous = byType.put(repository.supportedType(), repository);
            if (previous != null) {
                throw new IllegalStateException("상품 유형에 저장소가 중복 등록되었습니다: " + repository.supportedType());
            }
        }
        for (ItemType type : ItemType.values()) {
            if (!byType.containsKey(type)) {
                throw new IllegalStateException("상품 유형에 대한 저장소가 없습니다: " + type);
            }
        }
        this.repositories = byType;
    }

    /**
     * 상품 참조 해석 (상태 무관)
     *
     * @param itemRef 상품 참조
     * @return 상품, 없으면 empty
     */
    public Optional<CatalogItem> resolve(ItemRef itemRef) {
        return repositories.get(itemRef.getItemType())
                .findById(itemRef.getItemId())
                .map(CatalogItem.class::cast);
    }

    /**
     * 상품 조회, 없으면 예외
     *
     * @throws CatalogItemNotFoundException 상품이 없는 경우
     */
    public CatalogItem getItem(ItemRef itemRef) {
        return resolve(itemRef).orElseThrow(() -> new CatalogItemNotFoundException(itemRef));
    }

    /**
     * 유형별 ACTIVE 상품 목록
     */
    public List<CatalogItem> listActive(ItemType itemType) {
        return new ArrayList<>(repositories.get(itemType).findAllActive());
    }
}
