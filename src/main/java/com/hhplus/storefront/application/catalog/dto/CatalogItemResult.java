package com.hhplus.storefront.application.catalog.dto;

import com.hhplus.storefront.domain.catalog.CatalogItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 상품 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogItemResult {
    private String itemType;
    private Long itemId;
    private String name;
    private String photo;
    private Long originalPrice;
    private Long discount;
    private Long finalPrice;
    private String description;
    private String status;
    private LocalDateTime createdAt;

    public static CatalogItemResult from(CatalogItem item) {
        return CatalogItemResult.builder()
                .itemType(item.getItemType().getCode())
                .itemId(item.getItemId())
                .name(item.getName())
                .photo(item.getPhoto())
                .originalPrice(item.getOriginalPrice())
                .discount(item.getDiscount())
                .finalPrice(item.getFinalPrice())
                .description(item.getDescription())
                .status(item.getStatus().name())
                .createdAt(item.getCreatedAt())
                .build();
    }
}
