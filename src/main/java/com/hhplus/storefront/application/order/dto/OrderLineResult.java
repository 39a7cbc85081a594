package com.hhplus.storefront.application.order.dto;

import com.hhplus.storefront.domain.catalog.CatalogItem;
import com.hhplus.storefront.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 항목 결과 (Application layer 내부 DTO)
 *
 * 수량/단가는 주문 시점 스냅샷이다.
 * name, photo는 현재 카탈로그에서 가져온 표시용 정보이며 상품이 삭제되었으면 null이다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineResult {
    private Long orderItemId;
    private String itemType;
    private Long itemId;
    private String name;
    private String photo;
    private Integer quantity;
    private Long unitPrice;
    private Long lineTotal;

    public static OrderLineResult from(OrderItem orderItem, CatalogItem catalogItem) {
        return OrderLineResult.builder()
                .orderItemId(orderItem.getOrderItemId())
                .itemType(orderItem.getItemType().getCode())
                .itemId(orderItem.getItemId())
                .name(catalogItem != null ? catalogItem.getName() : null)
                .photo(catalogItem != null ? catalogItem.getPhoto() : null)
                .quantity(orderItem.getQuantity())
                .unitPrice(orderItem.getUnitPrice())
                .lineTotal(orderItem.getLineTotal())
                .build();
    }
}
