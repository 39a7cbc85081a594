package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.catalog.CatalogLookup;
import com.hhplus.storefront.application.order.dto.OrderLineResult;
import com.hhplus.storefront.application.order.dto.OrderResult;
import com.hhplus.storefront.application.order.dto.PlaceOrderCommand;
import com.hhplus.storefront.domain.order.InvalidOrderRequestException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderDomainService;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.user.User;
import com.hhplus.storefront.domain.user.UserNotFoundException;
import com.hhplus.storefront.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderService - Application 계층
 *
 * 역할:
 * - 주문서 검증 및 배송지 결정 (트랜잭션 진입 전)
 * - 주문 생성은 OrderTransactionService에 위임
 * - 주문 내역 조회 (최신순, 항목 포함)
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderTransactionService orderTransactionService;
    private final OrderRepository orderRepository;
    private final UserRepository userRepository;
    private final OrderDomainService orderDomainService;
    private final CatalogLookup catalogLookup;

    public OrderService(OrderTransactionService orderTransactionService,
                        OrderRepository orderRepository,
                        UserRepository userRepository,
                        OrderDomainService orderDomainService,
                        CatalogLookup catalogLookup) {
        this.orderTransactionService = orderTransactionService;
        this.orderRepository = orderRepository;
        this.userRepository = userRepository;
        this.orderDomainService = orderDomainService;
        this.catalogLookup = catalogLookup;
    }

    /**
     * 장바구니로 주문 생성
     *
     * @throws UserNotFoundException 사용자 없음
     * @throws InvalidOrderRequestException 결제 수단/배송지 오류
     * @throws com.hhplus.storefront.domain.cart.EmptyCartException 장바구니가 비어 있음
     */
    public OrderResult placeOrder(Long userId, PlaceOrderCommand command) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));

        String deliveryLocation = orderDomainService.resolveDeliveryLocation(command.getDeliveryLocation(), user);
        orderDomainService.validateOrderRequest(command.getPaymentMode(), deliveryLocation);

        Order order = orderTransactionService.placeOrder(userId, command.getPaymentMode(), deliveryLocation);

        log.info("[OrderService] 주문 접수: orderId={}, userId={}, totalAmount={}",
                order.getOrderId(), userId, order.getTotalAmount());
        return toOrderResult(order);
    }

    /**
     * 주문 내역 조회 (최신순)
     */
    @Transactional(readOnly = true)
    public List<OrderResult> getOrderHistory(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }

        return orderRepository.findAllByUserIdWithItems(userId).stream()
                .map(this::toOrderResult)
                .collect(Collectors.toList());
    }

    private OrderResult toOrderResult(Order order) {
        List<OrderLineResult> lines = order.getOrderItems().stream()
                .map(item -> OrderLineResult.from(item, catalogLookup.resolve(item.getItemRef()).orElse(null)))
                .collect(Collectors.toList());
        return OrderResult.from(order, lines);
    }
}
