package com.hhplus.storefront.domain.catalog;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * MenuItem 도메인 엔티티
 * 메뉴 상품 (menu_items 테이블)
 */
@Entity
@Table(name = "menu_items")
@Getter
@SuperBuilder
@NoArgsConstructor
public class MenuItem extends CatalogItem {

    @Override
    public ItemType getItemType() {
        return ItemType.MENU;
    }
}
