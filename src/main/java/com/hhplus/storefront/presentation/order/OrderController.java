package com.hhplus.storefront.presentation.order;

import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.application.order.dto.OrderResult;
import com.hhplus.storefront.presentation.order.mapper.OrderMapper;
import com.hhplus.storefront.presentation.order.request.PlaceOrderRequest;
import com.hhplus.storefront.presentation.order.response.OrderHistoryResponse;
import com.hhplus.storefront.presentation.order.response.OrderResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * OrderController - Presentation 계층
 * 주문 생성 및 주문 내역 API
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    /**
     * POST /orders - 장바구니로 주문 생성
     * 성공 시 장바구니는 비워진다.
     */
    @PostMapping
    public ResponseEntity<OrderResponse> placeOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody PlaceOrderRequest request) {
        OrderResult result = orderService.placeOrder(userId, orderMapper.toPlaceOrderCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(orderMapper.toOrderResponse(result));
    }

    /**
     * GET /orders - 주문 내역 (최신순)
     */
    @GetMapping
    public ResponseEntity<OrderHistoryResponse> getOrderHistory(@RequestHeader("X-USER-ID") Long userId) {
        List<OrderResult> results = orderService.getOrderHistory(userId);
        return ResponseEntity.ok(orderMapper.toOrderHistoryResponse(userId, results));
    }
}
