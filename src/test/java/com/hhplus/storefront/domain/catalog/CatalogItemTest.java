package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.domain.common.AmountOverflowException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogItem 도메인 테스트")
class CatalogItemTest {

    @Test
    @DisplayName("청구 금액은 finalPrice 기준 (원가 - 할인으로 재계산하지 않음)")
    void testPriceFor_UsesStoredFinalPrice() {
        // Given: 원가 10000, 할인 1000이지만 수동 조정된 finalPrice 8500
        ServiceItem item = ServiceItem.builder()
                .itemId(1L)
                .name("에어컨 청소")
                .originalPrice(10000L)
                .discount(1000L)
                .finalPrice(8500L)
                .build();

        // When & Then
        assertEquals(8500L, item.priceFor(1));
        assertEquals(25500L, item.priceFor(3));
    }

    @Test
    @DisplayName("수량이 1 미만이면 예외")
    void testPriceFor_InvalidQuantity() {
        MenuItem item = MenuItem.builder().itemId(1L).name("비빔밥").originalPrice(9000L).finalPrice(9000L).build();

        assertThrows(IllegalArgumentException.class, () -> item.priceFor(0));
    }

    @Test
    @DisplayName("기본값 - ACTIVE, 할인 0")
    void testDefaults() {
        MenuItem item = MenuItem.builder().itemId(3L).name("김밥").originalPrice(3000L).finalPrice(3000L).build();

        assertTrue(item.isActive());
        assertEquals(0L, item.getDiscount());
        assertNotNull(item.getCreatedAt());
    }

    @Test
    @DisplayName("유형별 참조 생성")
    void testToItemRef() {
        ServiceItem service = ServiceItem.builder().itemId(5L).name("수리").originalPrice(1L).finalPrice(1L).build();
        MenuItem menu = MenuItem.builder().itemId(5L).name("라면").originalPrice(1L).finalPrice(1L)
                .status(CatalogItemStatus.INACTIVE).build();

        assertEquals(ItemRef.of(ItemType.SERVICE, 5L), service.toItemRef());
        assertEquals(ItemRef.of(ItemType.MENU, 5L), menu.toItemRef());
        assertFalse(menu.isActive());
    }

    @Test
    @DisplayName("단가 × 수량이 long 범위를 넘으면 금액 초과 예외")
    void testPriceFor_Overflow() {
        ServiceItem item = ServiceItem.builder().itemId(1L).name("고가 서비스")
                .originalPrice(Long.MAX_VALUE / 2 + 1).finalPrice(Long.MAX_VALUE / 2 + 1).build();

        AmountOverflowException exception = assertThrows(AmountOverflowException.class, () -> item.priceFor(2));
        assertEquals(ErrorCode.AMOUNT_OVERFLOW, exception.getErrorCode());
    }
}
