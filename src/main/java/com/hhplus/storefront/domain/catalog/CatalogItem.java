package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.domain.common.AmountOverflowException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.LocalDateTime;

/**
 * CatalogItem - 카탈로그 상품 공통 매핑 (서비스/메뉴)
 *
 * 책임:
 * - 두 상품 테이블(services, menu_items)의 공통 컬럼 정의
 * - 수량별 금액 계산
 * - 상품 참조(ItemRef) 생성
 *
 * 핵심 비즈니스 규칙:
 * - finalPrice가 실제 청구 금액이다 (originalPrice - discount로 재계산하지 않음)
 *   수동으로 조정된 가격을 그대로 반영하기 위해 별도 컬럼으로 저장
 * - INACTIVE 상품은 목록에서 제외되지만 ID로는 계속 조회된다
 *   (이미 장바구니/주문에 담긴 상품 참조가 깨지지 않도록)
 */
@MappedSuperclass
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public abstract class CatalogItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "item_id")
    private Long itemId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "photo", length = 200)
    private String photo;

    @Column(name = "original_price", nullable = false)
    private Long originalPrice;

    @Column(name = "discount", nullable = false)
    @lombok.Builder.Default
    private Long discount = 0L;

    @Column(name = "final_price", nullable = false)
    private Long finalPrice;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @lombok.Builder.Default
    private CatalogItemStatus status = CatalogItemStatus.ACTIVE;

    @Column(name = "created_at", nullable = false, updatable = false)
    @lombok.Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    /**
     * 상품 유형 (테이블별로 고정)
     */
    public abstract ItemType getItemType();

    /**
     * 이 상품을 가리키는 참조
     */
    public ItemRef toItemRef() {
        return ItemRef.of(getItemType(), this.itemId);
    }

    /**
     * 목록 노출 여부
     */
    public boolean isActive() {
        return this.status == CatalogItemStatus.ACTIVE;
    }

    /**
     * 수량에 대한 청구 금액 (finalPrice × 수량)
     *
     * @param quantity 수량 (1 이상)
     * @return 항목 금액
     * @throws AmountOverflowException 항목 금액이 long 범위를 넘는 경우
     */
    public long priceFor(int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다: " + quantity);
        }
        try {
            return Math.multiplyExact(this.finalPrice, (long) quantity);
        } catch (ArithmeticException e) {
            throw new AmountOverflowException(toItemRef() + " x " + quantity, e);
        }
    }
}
