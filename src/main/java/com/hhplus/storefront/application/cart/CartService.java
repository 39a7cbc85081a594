package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.application.cart.dto.AddCartItemCommand;
import com.hhplus.storefront.application.cart.dto.CartItemResult;
import com.hhplus.storefront.application.cart.dto.CartLineResult;
import com.hhplus.storefront.application.cart.dto.CartResult;
import com.hhplus.storefront.domain.cart.*;
import com.hhplus.storefront.domain.catalog.ItemRef;
import com.hhplus.storefront.domain.catalog.InvalidItemTypeException;
import com.hhplus.storefront.domain.catalog.ItemType;
import com.hhplus.storefront.domain.common.vo.Quantity;
import com.hhplus.storefront.domain.user.UserNotFoundException;
import com.hhplus.storefront.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CartService - Application 계층
 * 장바구니 추가/조회/삭제
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository 인터페이스에만 의존 (Port)
 * - Infrastructure 계층의 구현체는 DI를 통해 주입됨 (Adapter)
 *
 * 장바구니 추가는 카탈로그를 조회하지 않는다. 가격은 조회/주문 시점에 계산된다.
 */
@Service
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final CartRepository cartRepository;
    private final UserRepository userRepository;
    private final CartPricingCalculator cartPricingCalculator;

    public CartService(CartRepository cartRepository,
                       UserRepository userRepository,
                       CartPricingCalculator cartPricingCalculator) {
        this.cartRepository = cartRepository;
        this.userRepository = userRepository;
        this.cartPricingCalculator = cartPricingCalculator;
    }

    /**
     * 장바구니에 상품 추가
     *
     * 같은 (사용자, 상품 유형, 상품 ID) 항목이 있으면 수량을 누적하고, 없으면 새로 만든다.
     *
     * @throws InvalidItemTypeException 상품 유형 오류
     * @throws InvalidItemIdException 상품 ID 누락 또는 1 미만
     * @throws InvalidQuantityException 수량이 1 이상의 정수가 아님
     * @throws UserNotFoundException 사용자 없음
     */
    @Transactional
    public CartItemResult addItem(Long userId, AddCartItemCommand command) {
        ItemType itemType = ItemType.from(command.getItemType());
        if (command.getItemId() == null || command.getItemId() < 1) {
            throw new InvalidItemIdException(command.getItemId());
        }
        ItemRef itemRef = ItemRef.of(itemType, command.getItemId());
        Quantity quantity = parseQuantity(command.getQuantity());

        validateUserExists(userId);

        Optional<CartItem> existing = cartRepository.findByUserIdAndItem(userId, itemRef);
        CartItem cartItem;
        if (existing.isPresent()) {
            cartItem = existing.get();
            cartItem.increaseQuantity(quantity);
        } else {
            cartItem = CartItem.create(userId, itemRef, quantity);
        }
        CartItem saved = cartRepository.save(cartItem);

        log.info("[CartService] 장바구니 추가: userId={}, item={}, added={}, quantity={}",
                userId, itemRef, quantity.getQuantity(), saved.getQuantity());
        return CartItemResult.from(saved);
    }

    /**
     * 장바구니 조회
     * 카탈로그에서 찾을 수 없는 항목은 목록과 합계에서 제외된다.
     */
    @Transactional(readOnly = true)
    public CartResult getCart(Long userId) {
        validateUserExists(userId);

        List<CartItem> cartItems = cartRepository.findAllByUserId(userId);
        PricedCart pricedCart = cartPricingCalculator.price(cartItems);

        List<CartLineResult> lines = pricedCart.getLines().stream()
                .map(CartLineResult::from)
                .collect(Collectors.toList());

        return CartResult.builder()
                .userId(userId)
                .items(lines)
                .totalItems(lines.size())
                .totalAmount(pricedCart.getTotalAmount())
                .build();
    }

    /**
     * 장바구니 항목 삭제
     *
     * @throws CartItemNotFoundException 항목 없음
     * @throws CartAccessDeniedException 다른 사용자의 항목 (항목은 그대로 유지)
     */
    @Transactional
    public void removeItem(Long userId, Long cartItemId) {
        validateUserExists(userId);

        CartItem cartItem = cartRepository.findById(cartItemId)
                .orElseThrow(() -> new CartItemNotFoundException(cartItemId));

        if (!cartItem.isOwnedBy(userId)) {
            log.warn("[CartService] 다른 사용자의 장바구니 항목 삭제 시도: cartItemId={}, ownerId={}, requesterId={}",
                    cartItemId, cartItem.getUserId(), userId);
            throw new CartAccessDeniedException(cartItemId, userId);
        }

        cartRepository.delete(cartItem);
        log.info("[CartService] 장바구니 항목 삭제: userId={}, cartItemId={}", userId, cartItemId);
    }

    private Quantity parseQuantity(String rawQuantity) {
        String value = rawQuantity == null ? CartConstants.DEFAULT_QUANTITY : rawQuantity;
        try {
            return Quantity.parse(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidQuantityException(rawQuantity, e);
        }
    }

    private void validateUserExists(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
    }
}
