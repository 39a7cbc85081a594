package com.hhplus.storefront.infrastructure.persistence.catalog;

import com.hhplus.storefront.domain.catalog.CatalogItemStatus;
import com.hhplus.storefront.domain.catalog.ServiceItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * ServiceItem JPA Repository
 * Spring Data JPA를 통한 services 테이블 저장소
 */
public interface ServiceItemJpaRepository extends JpaRepository<ServiceItem, Long> {
    List<ServiceItem> findByStatusOrderByItemIdAsc(CatalogItemStatus status);
}
