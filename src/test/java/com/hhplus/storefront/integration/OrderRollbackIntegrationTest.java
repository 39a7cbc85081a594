package com.hhplus.storefront.integration;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.cart.dto.AddCartItemCommand;
import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.application.order.dto.PlaceOrderCommand;
import com.hhplus.storefront.domain.cart.CartRepository;
import com.hhplus.storefront.domain.catalog.MenuItem;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.user.User;
import com.hhplus.storefront.domain.user.UserRepository;
import com.hhplus.storefront.infrastructure.persistence.catalog.MenuItemJpaRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;

/**
 * OrderRollbackIntegrationTest - 주문 생성 원자성 검증
 *
 * 장바구니 비우기 단계에서 실패하면 이미 저장한 주문까지 롤백되어야 한다.
 */
@DisplayName("주문 생성 롤백 통합 테스트")
class OrderRollbackIntegrationTest extends BaseIntegrationTest {

    @MockitoSpyBean
    private CartRepository cartRepository;

    @Autowired
    private CartService cartService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private MenuItemJpaRepository menuItemRepository;

    @Test
    @DisplayName("장바구니 비우기 실패 → 주문 미생성, 장바구니 유지")
    void testPlaceOrder_RollbackWhenCartClearFails() {
        // Given
        Long userId = userRepository.save(User.create("롤백", "01099998888", "rollback@test.com", "인천")).getUserId();
        MenuItem menu = menuItemRepository.save(MenuItem.builder()
                .name("라면").originalPrice(4000L).finalPrice(4000L).build());
        cartService.addItem(userId, AddCartItemCommand.builder()
                .itemType("menu").itemId(menu.getItemId()).quantity("3").build());

        doThrow(new DataAccessResourceFailureException("cart clear failed"))
                .when(cartRepository).deleteAllByUserId(anyLong());

        // When
        assertThrows(DataAccessResourceFailureException.class,
                () -> orderService.placeOrder(userId, PlaceOrderCommand.builder().paymentMode("CARD").build()));

        // Then
        assertEquals(0L, orderRepository.countByUserId(userId));
        assertEquals(1, cartRepository.findAllByUserId(userId).size());
        assertEquals(3, cartRepository.findAllByUserId(userId).get(0).getQuantity());
    }
}
