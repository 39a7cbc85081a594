package com.hhplus.storefront.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {
    @JsonProperty("delivery_location")
    private String deliveryLocation;

    @JsonProperty("payment_mode")
    private String paymentMode;
}
