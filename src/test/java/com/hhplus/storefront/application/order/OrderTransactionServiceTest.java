package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.cart.CartPricingCalculator;
import com.hhplus.storefront.application.catalog.CatalogLookup;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.SystemException;
import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.cart.EmptyCartException;
import com.hhplus.storefront.domain.catalog.ItemRef;
import com.hhplus.storefront.domain.catalog.ItemType;
import com.hhplus.storefront.domain.catalog.MenuItem;
import com.hhplus.storefront.domain.catalog.ServiceItem;
import com.hhplus.storefront.domain.common.AmountOverflowException;
import com.hhplus.storefront.domain.common.vo.Quantity;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderDomainService;
import com.hhplus.storefront.domain.order.OrderItem;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.user.User;
import com.hhplus.storefront.domain.user.UserNotFoundException;
import com.hhplus.storefront.infrastructure.persistence.cart.InMemoryCartRepository;
import com.hhplus.storefront.infrastructure.persistence.catalog.InMemoryCatalogItemRepository;
import com.hhplus.storefront.infrastructure.persistence.order.InMemoryOrderRepository;
import com.hhplus.storefront.infrastructure.persistence.user.InMemoryUserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrderTransactionServiceTest - 장바구니 → 주문 전환 테스트
 *
 * In-Memory 저장소를 사용하므로 트랜잭션/재시도 프록시는 적용되지 않는다.
 * 롤백과 재시도 경계는 OrderTransactionProxyTest에서 검증한다.
 */
@DisplayName("OrderTransactionService 테스트")
class OrderTransactionServiceTest {

    private InMemoryCartRepository cartRepository;
    private InMemoryOrderRepository orderRepository;
    private InMemoryCatalogItemRepository<ServiceItem> serviceRepository;
    private InMemoryCatalogItemRepository<MenuItem> menuRepository;
    private OrderTransactionService orderTransactionService;

    private Long userId;
    private ServiceItem itemA;
    private MenuItem itemB;

    @BeforeEach
    void setup() {
        cartRepository = new InMemoryCartRepository();
        orderRepository = new InMemoryOrderRepository();
        InMemoryUserRepository userRepository = new InMemoryUserRepository();
        serviceRepository = new InMemoryCatalogItemRepository<>(ItemType.SERVICE);
        menuRepository = new InMemoryCatalogItemRepository<>(ItemType.MENU);
        CatalogLookup catalogLookup = new CatalogLookup(List.of(serviceRepository, menuRepository));

        orderTransactionService = new OrderTransactionService(
                userRepository,
                cartRepository,
                orderRepository,
                new CartPricingCalculator(catalogLookup),
                new OrderDomainService());

        userId = userRepository.save(User.create("박민수", "01055556666", "park@example.com", "부산")).getUserId();
        itemA = serviceRepository.save(ServiceItem.builder().name("A").originalPrice(100L).finalPrice(100L).build());
        itemB = menuRepository.save(MenuItem.builder().name("B").originalPrice(60L).discount(10L).finalPrice(50L).build());
    }

    @Test
    @DisplayName("A×2(100) + B×1(50) → 총액 250, 장바구니 비움")
    void testPlaceOrder_Success() {
        // Given
        addToCart(itemA.toItemRef(), 2);
        addToCart(itemB.toItemRef(), 1);

        // When
        Order order = orderTransactionService.placeOrder(userId, "CARD", "부산 해운대구");

        // Then
        assertNotNull(order.getOrderId());
        assertEquals(250L, order.getTotalAmount());
        assertEquals(2, order.getOrderItemCount());
        assertEquals("CARD", order.getPaymentMode());
        assertEquals("부산 해운대구", order.getDeliveryLocation());
        assertEquals(OrderStatus.PENDING, order.getOrderStatus());
        assertEquals(0, cartRepository.findAllByUserId(userId).size());
        assertEquals(1L, orderRepository.countByUserId(userId));
    }

    @Test
    @DisplayName("빈 장바구니 → EmptyCartException, 주문 미생성")
    void testPlaceOrder_EmptyCart() {
        EmptyCartException exception = assertThrows(EmptyCartException.class,
                () -> orderTransactionService.placeOrder(userId, "CARD", "부산"));

        assertEquals("DOMAIN_CART_EMPTY", exception.getErrorCodeValue());
        assertEquals(0L, orderRepository.countByUserId(userId));
    }

    @Test
    @DisplayName("카탈로그에서 삭제된 상품은 주문에서 제외되고 장바구니에서는 모두 비워짐")
    void testPlaceOrder_SkipsDeletedItem() {
        // Given
        addToCart(itemA.toItemRef(), 2);
        addToCart(itemB.toItemRef(), 1);
        menuRepository.deleteById(itemB.getItemId());

        // When
        Order order = orderTransactionService.placeOrder(userId, "CASH", "부산");

        // Then
        assertEquals(200L, order.getTotalAmount());
        assertEquals(1, order.getOrderItemCount());
        assertEquals(ItemType.SERVICE, order.getOrderItems().get(0).getItemType());
        assertEquals(0, cartRepository.findAllByUserId(userId).size());
    }

    @Test
    @DisplayName("모든 상품이 삭제된 경우 총액 0인 주문 생성")
    void testPlaceOrder_AllItemsUnresolvable() {
        addToCart(ItemRef.of(ItemType.MENU, 404L), 3);

        Order order = orderTransactionService.placeOrder(userId, "CARD", "부산");

        assertEquals(0L, order.getTotalAmount());
        assertEquals(0, order.getOrderItemCount());
        assertEquals(0, cartRepository.findAllByUserId(userId).size());
    }

    @Test
    @DisplayName("주문 후 카탈로그 가격이 바뀌어도 주문 금액은 유지 (단가 스냅샷)")
    void testPlaceOrder_PriceSnapshot() {
        // Given
        addToCart(itemA.toItemRef(), 2);
        Order order = orderTransactionService.placeOrder(userId, "CARD", "부산");

        // When
        itemA.setFinalPrice(999L);

        // Then
        Order stored = orderRepository.findById(order.getOrderId()).orElseThrow();
        assertEquals(200L, stored.getTotalAmount());
        assertEquals(100L, stored.getOrderItems().get(0).getUnitPrice());
    }

    @Test
    @DisplayName("총액 = Σ(단가 × 수량)")
    void testPlaceOrder_TotalEqualsSumOfLines() {
        addToCart(itemA.toItemRef(), 7);
        addToCart(itemB.toItemRef(), 13);

        Order order = orderTransactionService.placeOrder(userId, "CARD", "부산");

        long sum = order.getOrderItems().stream()
                .mapToLong(item -> item.getUnitPrice() * item.getQuantity())
                .sum();
        assertEquals(sum, order.getTotalAmount());
        assertEquals(1350L, order.getTotalAmount());
        for (OrderItem item : order.getOrderItems()) {
            assertNotNull(item.getOrderItemId());
        }
    }

    @Test
    @DisplayName("총액이 long 범위를 넘으면 금액 초과 오류 - 장바구니 유지, 주문 미생성")
    void testPlaceOrder_TotalOverflow() {
        // Given
        long price = Long.MAX_VALUE / 2 + 1;
        ServiceItem first = serviceRepository.save(ServiceItem.builder().name("고가1").originalPrice(price).finalPrice(price).build());
        ServiceItem second = serviceRepository.save(ServiceItem.builder().name("고가2").originalPrice(price).finalPrice(price).build());
        addToCart(first.toItemRef(), 1);
        addToCart(second.toItemRef(), 1);

        // When
        AmountOverflowException exception = assertThrows(AmountOverflowException.class,
                () -> orderTransactionService.placeOrder(userId, "CARD", "부산"));

        // Then
        assertEquals(ErrorCode.AMOUNT_OVERFLOW, exception.getErrorCode());
        assertEquals(2, cartRepository.findAllByUserId(userId).size());
        assertEquals(0L, orderRepository.countByUserId(userId));
    }

    @Test
    @DisplayName("항목 금액이 long 범위를 넘으면 금액 초과 오류 - 장바구니 유지")
    void testPlaceOrder_LineOverflow() {
        itemA.setFinalPrice(Long.MAX_VALUE / 2);
        addToCart(itemA.toItemRef(), 3);

        assertThrows(AmountOverflowException.class,
                () -> orderTransactionService.placeOrder(userId, "CARD", "부산"));

        assertEquals(1, cartRepository.findAllByUserId(userId).size());
        assertEquals(0L, orderRepository.countByUserId(userId));
    }

    @Test
    @DisplayName("같은 장바구니로 연속 주문 - 두 번째는 빈 장바구니, 주문은 1건")
    void testPlaceOrder_SecondSubmitSeesEmptyCart() {
        // Given
        addToCart(itemA.toItemRef(), 2);
        orderTransactionService.placeOrder(userId, "CARD", "부산");

        // When & Then
        assertThrows(EmptyCartException.class,
                () -> orderTransactionService.placeOrder(userId, "CARD", "부산"));
        assertEquals(1L, orderRepository.countByUserId(userId));
    }

    @Test
    @DisplayName("다른 사용자의 장바구니는 건드리지 않음")
    void testPlaceOrder_OtherUserCartUntouched() {
        addToCart(itemA.toItemRef(), 1);
        cartRepository.save(CartItem.create(userId + 100, itemB.toItemRef(), Quantity.of(4)));

        orderTransactionService.placeOrder(userId, "CARD", "부산");

        assertEquals(1, cartRepository.findAllByUserId(userId + 100).size());
    }

    @Test
    @DisplayName("없는 사용자 → UserNotFoundException")
    void testPlaceOrder_UserNotFound() {
        assertThrows(UserNotFoundException.class,
                () -> orderTransactionService.placeOrder(999L, "CARD", "부산"));
    }

    @Test
    @DisplayName("락 재시도 초과 복구 → LOCK_ACQUISITION_FAILED")
    void testRecoverLockFailure() {
        PessimisticLockingFailureException cause = new PessimisticLockingFailureException("lock timeout");

        SystemException exception = assertThrows(SystemException.class,
                () -> orderTransactionService.recoverLockFailure(cause, userId, "CARD", "부산"));

        assertEquals(ErrorCode.LOCK_ACQUISITION_FAILED, exception.getErrorCode());
        assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("재시도 대상이 아닌 예외는 그대로 전달")
    void testRethrow() {
        EmptyCartException original = new EmptyCartException(userId);

        EmptyCartException thrown = assertThrows(EmptyCartException.class,
                () -> orderTransactionService.rethrow(original, userId, "CARD", "부산"));

        assertSame(original, thrown);
    }

    private void addToCart(ItemRef itemRef, int quantity) {
        cartRepository.save(CartItem.create(userId, itemRef, Quantity.of(quantity)));
    }
}
