package com.hhplus.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 응답 DTO (주문 생성, 주문 내역 공용)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("total_amount")
    private Long totalAmount;

    @JsonProperty("payment_mode")
    private String paymentMode;

    @JsonProperty("delivery_location")
    private String deliveryLocation;

    @JsonProperty("order_status")
    private String orderStatus;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("order_date")
    private LocalDateTime orderDate;

    private List<OrderLineResponse> items;
}
