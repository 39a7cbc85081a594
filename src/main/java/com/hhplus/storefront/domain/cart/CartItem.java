package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.domain.catalog.ItemRef;
import com.hhplus.storefront.domain.catalog.ItemType;
import com.hhplus.storefront.domain.common.vo.Quantity;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * CartItem 도메인 엔티티
 * 장바구니 한 줄: (사용자, 상품 유형, 상품 ID) 당 하나, 수량은 1 이상
 *
 * 가격은 저장하지 않는다. 장바구니 조회와 주문 시점에 카탈로그에서 다시 계산한다.
 */
@Entity
@Table(name = "cart", uniqueConstraints = {
    @UniqueConstraint(name = "uk_cart_user_item", columnNames = {"user_id", "item_type", "item_id"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {

    /** 장바구니 목록 정렬 순서: 상품 유형(이름순), 상품 ID, 항목 ID */
    public static final Comparator<CartItem> DISPLAY_ORDER = Comparator
            .comparing((CartItem item) -> item.getItemType().name())
            .thenComparing(CartItem::getItemId)
            .thenComparing(CartItem::getCartItemId, Comparator.nullsLast(Comparator.naturalOrder()));

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_item_id")
    private Long cartItemId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "item_type", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    private ItemType itemType;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "added_at", nullable = false, updatable = false)
    private LocalDateTime addedAt;

    /**
     * 새 장바구니 항목 생성
     */
    public static CartItem create(Long userId, ItemRef itemRef, Quantity quantity) {
        return CartItem.builder()
                .userId(userId)
                .itemType(itemRef.getItemType())
                .itemId(itemRef.getItemId())
                .quantity(quantity.getQuantity())
                .addedAt(LocalDateTime.now())
                .build();
    }

    /**
     * 같은 상품을 다시 담으면 요청 수량만큼 누적
     *
     * @throws InvalidQuantityException 누적 수량이 int 범위를 넘는 경우 (기존 수량 유지)
     */
    public void increaseQuantity(Quantity amount) {
        try {
            this.quantity = Quantity.of(this.quantity).add(amount).getQuantity();
        } catch (ArithmeticException e) {
            throw new InvalidQuantityException(this.quantity + " + " + amount.getQuantity(), e);
        }
    }

    public ItemRef getItemRef() {
        return ItemRef.of(this.itemType, this.itemId);
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId != null && this.userId.equals(userId);
    }
}
