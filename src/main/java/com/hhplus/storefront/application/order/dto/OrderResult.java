package com.hhplus.storefront.application.order.dto;

import com.hhplus.storefront.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 결과 (Application layer 내부 DTO)
 * Domain의 Order 엔티티로부터 변환
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResult {
    private Long orderId;
    private Long userId;
    private Long totalAmount;
    private String paymentMode;
    private String deliveryLocation;
    private String orderStatus;
    private LocalDateTime orderDate;
    private List<OrderLineResult> items;

    public static OrderResult from(Order order, List<OrderLineResult> items) {
        return OrderResult.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .totalAmount(order.getTotalAmount())
                .paymentMode(order.getPaymentMode())
                .deliveryLocation(order.getDeliveryLocation())
                .orderStatus(order.getOrderStatus().getCode())
                .orderDate(order.getCreatedAt())
                .items(items)
                .build();
    }
}
