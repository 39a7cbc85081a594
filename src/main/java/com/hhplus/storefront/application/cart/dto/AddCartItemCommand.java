package com.hhplus.storefront.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 추가 커맨드 (Application layer 내부 DTO)
 *
 * itemType, quantity는 검증 전 원본 문자열이다.
 * quantity가 null이면 1로 처리한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemCommand {
    private String itemType;
    private Long itemId;
    private String quantity;
}
