package com.hhplus.storefront.infrastructure.persistence.catalog;

import com.hhplus.storefront.domain.catalog.CatalogItemRepository;
import com.hhplus.storefront.domain.catalog.CatalogItemStatus;
import com.hhplus.storefront.domain.catalog.ItemType;
import com.hhplus.storefront.domain.catalog.ServiceItem;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 서비스 상품 Repository 구현
 * Port(CatalogItemRepository)의 SERVICE 유형 구현체
 */
@Repository
public class MySQLServiceItemRepository implements CatalogItemRepository<ServiceItem> {

    private final ServiceItemJpaRepository serviceItemJpaRepository;

    public MySQLServiceItemRepository(ServiceItemJpaRepository serviceItemJpaRepository) {
        this.serviceItemJpaRepository = serviceItemJpaRepository;
    }

    @Override
    public ItemType supportedType() {
        return ItemType.SERVICE;
    }

    @Override
    public Optional<ServiceItem> findById(Long itemId) {
        return serviceItemJpaRepository.findById(itemId);
    }

    @Override
    public List<ServiceItem> findAllActive() {
        return serviceItemJpaRepository.findByStatusOrderByItemIdAsc(CatalogItemStatus.ACTIVE);
    }
}
