package com.hhplus.storefront.domain.catalog;

import java.io.Serializable;
import java.util.Objects;

/**
 * ItemRef Value Object
 *
 * 카탈로그 상품에 대한 다형 참조입니다: SERVICE(id) | MENU(id).
 * 장바구니 항목과 주문 항목은 외래키 대신 이 참조로 상품을 가리키며,
 * 실제 상품 조회는 CatalogLookup이 유형별 저장소로 위임합니다.
 *
 * 특징:
 * - Immutable: 생성 후 변경 불가능
 * - 상품 ID는 1 이상
 * - equals/hashCode 구현으로 값 비교 가능
 */
public final class ItemRef implements Serializable {
    private static final long serialVersionUID = 1L;

    private final ItemType itemType;
    private final Long itemId;

    private ItemRef(ItemType itemType, Long itemId) {
        this.itemType = Objects.requireNonNull(itemType, "itemType은 null이 될 수 없습니다");
        if (itemId == null || itemId < 1) {
            throw new IllegalArgumentException("상품 ID는 1 이상이어야 합니다: " + itemId);
        }
        this.itemId = itemId;
    }

    public static ItemRef of(ItemType itemType, Long itemId) {
        return new ItemRef(itemType, itemId);
    }

    public ItemType getItemType() {
        return itemType;
    }

    public Long getItemId() {
        return itemId;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ItemRef)) {
            return false;
        }
        ItemRef other = (ItemRef) obj;
        return this.itemType == other.itemType && this.itemId.equals(other.itemId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemType, itemId);
    }

    @Override
    public String toString() {
        return itemType.getCode() + ":" + itemId;
    }
}
