package com.hhplus.storefront.infrastructure.persistence.catalog;

import com.hhplus.storefront.domain.catalog.CatalogItemStatus;
import com.hhplus.storefront.domain.catalog.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * MenuItem JPA Repository
 * Spring Data JPA를 통한 menu_items 테이블 저장소
 */
public interface MenuItemJpaRepository extends JpaRepository<MenuItem, Long> {
    List<MenuItem> findByStatusOrderByItemIdAsc(CatalogItemStatus status);
}
