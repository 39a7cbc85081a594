package com.hhplus.storefront.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 조회 결과 (Application layer 내부 DTO)
 * totalAmount는 화면 표시용이며 주문 시점에 다시 계산된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResult {
    private Long userId;
    private List<CartLineResult> items;
    private Integer totalItems;
    private Long totalAmount;
}
