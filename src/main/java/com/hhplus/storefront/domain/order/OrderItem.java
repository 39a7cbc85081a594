package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.domain.catalog.ItemRef;
import com.hhplus.storefront.domain.catalog.ItemType;
import com.hhplus.storefront.domain.common.AmountOverflowException;
import jakarta.persistence.*;
import lombok.*;

/**
 * OrderItem 도메인 엔티티
 *
 * 책임:
 * - 주문 시점의 상품 참조, 수량, 단가 스냅샷 보존
 * - 항목 금액 계산
 *
 * 핵심 비즈니스 규칙:
 * - unitPrice는 주문 시점의 상품 finalPrice를 복사한 값이며 이후 변경되지 않는다
 *   (상품 가격이 바뀌어도 원래 가격으로 청구)
 * - 수량은 1 이상
 * - 주문(Order)과 함께 저장되고 함께 삭제된다
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_item_id")
    private Long orderItemId;

    @Column(name = "item_type", nullable = false, length = 10, updatable = false)
    @Enumerated(EnumType.STRING)
    private ItemType itemType;

    @Column(name = "item_id", nullable = false, updatable = false)
    private Long itemId;

    @Column(name = "quantity", nullable = false, updatable = false)
    private Integer quantity;

    @Column(name = "price", nullable = false, updatable = false)
    private Long unitPrice;

    /**
     * 주문 항목 스냅샷 생성
     *
     * @param itemRef 상품 참조
     * @param quantity 수량 (1 이상)
     * @param unitPrice 주문 시점 단가 (0 이상)
     * @return OrderItem 인스턴스
     */
    public static OrderItem snapshot(ItemRef itemRef, int quantity, long unitPrice) {
        if (itemRef == null) {
            throw new IllegalArgumentException("상품 참조는 필수입니다");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다: " + quantity);
        }
        if (unitPrice < 0) {
            throw new IllegalArgumentException("단가는 음수가 될 수 없습니다: " + unitPrice);
        }

        return OrderItem.builder()
                .itemType(itemRef.getItemType())
                .itemId(itemRef.getItemId())
                .quantity(quantity)
                .unitPrice(unitPrice)
                .build();
    }

    public ItemRef getItemRef() {
        return ItemRef.of(this.itemType, this.itemId);
    }

    /**
     * 항목 금액 = 단가 × 수량
     */
    public long getLineTotal() {
        try {
            return Math.multiplyExact(this.unitPrice, (long) this.quantity);
        } catch (ArithmeticException e) {
            throw new AmountOverflowException(getItemRef() + " x " + this.quantity, e);
        }
    }
}
