package com.hhplus.storefront.presentation.order.mapper;

import com.hhplus.storefront.application.order.dto.OrderLineResult;
import com.hhplus.storefront.application.order.dto.OrderResult;
import com.hhplus.storefront.application.order.dto.PlaceOrderCommand;
import com.hhplus.storefront.presentation.order.request.PlaceOrderRequest;
import com.hhplus.storefront.presentation.order.response.OrderHistoryResponse;
import com.hhplus.storefront.presentation.order.response.OrderLineResponse;
import com.hhplus.storefront.presentation.order.response.OrderResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class OrderMapper {

    public PlaceOrderCommand toPlaceOrderCommand(PlaceOrderRequest request) {
        return PlaceOrderCommand.builder()
                .deliveryLocation(request.getDeliveryLocation())
                .paymentMode(request.getPaymentMode())
                .build();
    }

    public OrderResponse toOrderResponse(OrderResult result) {
        return OrderResponse.builder()
                .orderId(result.getOrderId())
                .totalAmount(result.getTotalAmount())
                .paymentMode(result.getPaymentMode())
                .deliveryLocation(result.getDeliveryLocation())
                .orderStatus(result.getOrderStatus())
                .orderDate(result.getOrderDate())
                .items(result.getItems().stream()
                        .map(this::toOrderLineResponse)
                        .collect(Collectors.toList()))
                .build();
    }

    public OrderHistoryResponse toOrderHistoryResponse(Long userId, List<OrderResult> results) {
        return OrderHistoryResponse.builder()
                .userId(userId)
                .orders(results.stream()
                        .map(this::toOrderResponse)
                        .collect(Collectors.toList()))
                .totalCount(results.size())
                .build();
    }

    private OrderLineResponse toOrderLineResponse(OrderLineResult line) {
        return OrderLineResponse.builder()
                .orderItemId(line.getOrderItemId())
                .itemType(line.getItemType())
                .itemId(line.getItemId())
                .name(line.getName())
                .photo(line.getPhoto())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .lineTotal(line.getLineTotal())
                .build();
    }
}
