package com.hhplus.storefront.integration;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.cart.dto.AddCartItemCommand;
import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.application.order.dto.OrderResult;
import com.hhplus.storefront.application.order.dto.PlaceOrderCommand;
import com.hhplus.storefront.domain.cart.CartRepository;
import com.hhplus.storefront.domain.cart.EmptyCartException;
import com.hhplus.storefront.domain.catalog.MenuItem;
import com.hhplus.storefront.domain.catalog.ServiceItem;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.user.User;
import com.hhplus.storefront.domain.user.UserRepository;
import com.hhplus.storefront.infrastructure.persistence.catalog.MenuItemJpaRepository;
import com.hhplus.storefront.infrastructure.persistence.catalog.ServiceItemJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrderPlacementIntegrationTest - 장바구니 → 주문 전환 통합 테스트
 *
 * 테스트 목표:
 * 1. 주문 생성 후 장바구니가 비워지고 주문 금액이 스냅샷으로 저장된다
 * 2. 같은 사용자의 동시 주문 요청은 직렬화되어 주문이 하나만 생성된다
 * 3. 주문 내역은 최신순으로 항목과 함께 조회된다
 */
@DisplayName("주문 생성 통합 테스트")
class OrderPlacementIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private CartService cartService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private CartRepository cartRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private ServiceItemJpaRepository serviceItemRepository;

    @Autowired
    private MenuItemJpaRepository menuItemRepository;

    private Long userId;
    private ServiceItem itemA;
    private MenuItem itemB;

    @BeforeEach
    void setup() {
        String testId = UUID.randomUUID().toString().substring(0, 8);
        User user = userRepository.save(User.create("통합테스트", "010" + testId, testId + "@test.com", "서울시 중구"));
        userId = user.getUserId();

        itemA = serviceItemRepository.save(ServiceItem.builder()
                .name("A 서비스").originalPrice(100L).finalPrice(100L).build());
        itemB = menuItemRepository.save(MenuItem.builder()
                .name("B 메뉴").originalPrice(50L).finalPrice(50L).build());
    }

    @Test
    @DisplayName("주문 생성 - 총액 250, 장바구니 비움, 가격 변경 후에도 주문 금액 유지")
    void testPlaceOrder_SnapshotAndClearCart() {
        // Given
        cartService.addItem(userId, command("service", itemA.getItemId(), "2"));
        cartService.addItem(userId, command("menu", itemB.getItemId(), "1"));

        // When
        OrderResult result = orderService.placeOrder(userId, PlaceOrderCommand.builder().paymentMode("CARD").build());

        // Then
        assertEquals(250L, result.getTotalAmount());
        assertEquals("서울시 중구", result.getDeliveryLocation());
        assertEquals(2, result.getItems().size());
        assertTrue(cartRepository.findAllByUserId(userId).isEmpty());

        itemA.setFinalPrice(999L);
        serviceItemRepository.save(itemA);

        List<OrderResult> history = orderService.getOrderHistory(userId);
        assertEquals(1, history.size());
        assertEquals(250L, history.get(0).getTotalAmount());
        assertEquals(result.getOrderId(), history.get(0).getOrderId());
    }

    @Test
    @DisplayName("주문 내역 - 최신 주문이 먼저")
    void testOrderHistory_NewestFirst() {
        cartService.addItem(userId, command("menu", itemB.getItemId(), "1"));
        OrderResult first = orderService.placeOrder(userId, PlaceOrderCommand.builder().paymentMode("CASH").build());
        cartService.addItem(userId, command("service", itemA.getItemId(), "1"));
        OrderResult second = orderService.placeOrder(userId, PlaceOrderCommand.builder().paymentMode("CARD").build());

        List<OrderResult> history = orderService.getOrderHistory(userId);

        assertEquals(2, history.size());
        assertEquals(second.getOrderId(), history.get(0).getOrderId());
        assertEquals(first.getOrderId(), history.get(1).getOrderId());
        assertEquals(1, history.get(0).getItems().size());
    }

    @Test
    @DisplayName("동시 주문 요청 - 주문 1건 생성, 나머지는 빈 장바구니")
    void testPlaceOrder_ConcurrentDoubleSubmit() throws InterruptedException {
        // Given
        cartService.addItem(userId, command("service", itemA.getItemId(), "2"));
        cartService.addItem(userId, command("menu", itemB.getItemId(), "1"));

        int numThreads = 5;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(numThreads);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger emptyCartCount = new AtomicInteger(0);
        AtomicInteger otherFailureCount = new AtomicInteger(0);
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        // When
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    orderService.placeOrder(userId, PlaceOrderCommand.builder().paymentMode("CARD").build());
                    successCount.incrementAndGet();
                } catch (EmptyCartException e) {
                    emptyCartCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    otherFailureCount.incrementAndGet();
                } catch (Exception e) {
                    otherFailureCount.incrementAndGet();
                } finally {
                    endLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(endLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        assertEquals(1, successCount.get());
        assertEquals(numThreads - 1, emptyCartCount.get());
        assertEquals(0, otherFailureCount.get());
        assertEquals(1L, orderRepository.countByUserId(userId));
        assertTrue(cartRepository.findAllByUserId(userId).isEmpty());
    }

    private AddCartItemCommand command(String itemType, Long itemId, String quantity) {
        return AddCartItemCommand.builder()
                .itemType(itemType)
                .itemId(itemId)
                .quantity(quantity)
                .build();
    }
}
