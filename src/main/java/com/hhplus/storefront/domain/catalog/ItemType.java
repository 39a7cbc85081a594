package com.hhplus.storefront.domain.catalog;

import lombok.Getter;

import java.util.Arrays;

/**
 * ItemType - 카탈로그 상품 유형 (Enum)
 *
 * 상품은 서비스(services 테이블)와 메뉴(menu_items 테이블) 두 종류로 나뉘며,
 * 장바구니/주문 항목은 (유형, 상품 ID) 쌍으로 상품을 참조합니다.
 *
 * - SERVICE: 서비스 상품 (code: "service")
 * - MENU: 메뉴 상품 (code: "menu")
 */
@Getter
public enum ItemType {
    SERVICE("service", "서비스"),
    MENU("menu", "메뉴");

    private final String code;
    private final String displayName;

    ItemType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * 요청 문자열에서 ItemType으로 변환
     * code("service")와 상수명("SERVICE") 모두 대소문자 구분 없이 허용
     *
     * @param value 요청으로 들어온 상품 유형 문자열
     * @return ItemType
     * @throws InvalidItemTypeException null, 공백 또는 알 수 없는 유형
     */
    public static ItemType from(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidItemTypeException(value);
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidItemTypeException(value));
    }
}
