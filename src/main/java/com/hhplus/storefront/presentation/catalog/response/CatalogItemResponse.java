package com.hhplus.storefront.presentation.catalog.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.application.catalog.dto.CatalogItemResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 상품 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogItemResponse {

    @JsonProperty("item_type")
    private String itemType;

    @JsonProperty("item_id")
    private Long itemId;

    private String name;

    private String photo;

    @JsonProperty("original_price")
    private Long originalPrice;

    private Long discount;

    @JsonProperty("final_price")
    private Long finalPrice;

    private String description;

    private String status;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static CatalogItemResponse from(CatalogItemResult result) {
        return CatalogItemResponse.builder()
                .itemType(result.getItemType())
                .itemId(result.getItemId())
                .name(result.getName())
                .photo(result.getPhoto())
                .originalPrice(result.getOriginalPrice())
                .discount(result.getDiscount())
                .finalPrice(result.getFinalPrice())
                .description(result.getDescription())
                .status(result.getStatus())
                .createdAt(result.getCreatedAt())
                .build();
    }
}
