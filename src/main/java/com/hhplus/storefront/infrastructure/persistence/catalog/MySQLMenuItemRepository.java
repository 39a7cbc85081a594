package com.hhplus.storefront.infrastructure.persistence.catalog;

import com.hhplus.storefront.domain.catalog.CatalogItemRepository;
import com.hhplus.storefront.domain.catalog.CatalogItemStatus;
import com.hhplus.storefront.domain.catalog.ItemType;
import com.hhplus.storefront.domain.catalog.MenuItem;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 메뉴 상품 Repository 구현
 * Port(CatalogItemRepository)의 MENU 유형 구현체
 */
@Repository
public class MySQLMenuItemRepository implements CatalogItemRepository<MenuItem> {

    private final MenuItemJpaRepository menuItemJpaRepository;

    public MySQLMenuItemRepository(MenuItemJpaRepository menuItemJpaRepository) {
        this.menuItemJpaRepository = menuItemJpaRepository;
    }

    @Override
    public ItemType supportedType() {
        return ItemType.MENU;
    }

    @Override
    public Optional<MenuItem> findById(Long itemId) {
        return menuItemJpaRepository.findById(itemId);
    }

    @Override
    public List<MenuItem> findAllActive() {
        return menuItemJpaRepository.findByStatusOrderByItemIdAsc(CatalogItemStatus.ACTIVE);
    }
}
