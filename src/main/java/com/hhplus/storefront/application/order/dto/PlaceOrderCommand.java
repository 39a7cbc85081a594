package com.hhplus.storefront.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 커맨드 (Application layer 내부 DTO)
 * deliveryLocation이 비어 있으면 사용자의 등록 주소가 사용된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderCommand {
    private String deliveryLocation;
    private String paymentMode;
}
