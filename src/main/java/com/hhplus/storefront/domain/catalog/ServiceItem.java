package com.hhplus.storefront.domain.catalog;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * ServiceItem 도메인 엔티티
 * 서비스 상품 (services 테이블, 설명은 short_description 컬럼)
 */
@Entity
@Table(name = "services")
@AttributeOverride(name = "description", column = @Column(name = "short_description", columnDefinition = "TEXT"))
@Getter
@SuperBuilder
@NoArgsConstructor
public class ServiceItem extends CatalogItem {

    @Override
    public ItemType getItemType() {
        return ItemType.SERVICE;
    }
}
