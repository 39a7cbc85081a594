package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.cart.CartPricingCalculator;
import com.hhplus.storefront.application.cart.PricedCart;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.SystemException;
import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.cart.CartRepository;
import com.hhplus.storefront.domain.cart.EmptyCartException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderDomainService;
import com.hhplus.storefront.domain.order.OrderItem;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.user.UserNotFoundException;
import com.hhplus.storefront.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderTransactionService - 주문 트랜잭션 처리 서비스 (Application 계층)
 *
 * 역할:
 * - 장바구니 → 주문 전환을 하나의 트랜잭션으로 처리
 * - OrderService와 분리하여 @Transactional, @Retryable이 프록시를 통해 적용되도록 한다
 *
 * 아키텍처:
 * OrderService (입력 검증, 배송지 결정, 응답 변환)
 *     ↓ (의존성 주입)
 * OrderTransactionService (락 획득, 가격 계산, 주문 저장, 장바구니 비우기)
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final UserRepository userRepository;
    private final CartRepository cartRepository;
    private final OrderRepository orderRepository;
    private final CartPricingCalculator cartPricingCalculator;
    private final OrderDomainService orderDomainService;

    public OrderTransactionService(UserRepository userRepository,
                                   CartRepository cartRepository,
                                   OrderRepository orderRepository,
                                   CartPricingCalculator cartPricingCalculator,
                                   OrderDomainService orderDomainService) {
        this.userRepository = userRepository;
        this.cartRepository = cartRepository;
        this.orderRepository = orderRepository;
        this.cartPricingCalculator = cartPricingCalculator;
        this.orderDomainService = orderDomainService;
    }

    /**
     * 장바구니로 주문 생성 (원자적 처리)
     *
     * 처리 순서:
     * 1. 사용자 행 비관적 락 (같은 사용자의 주문 생성 직렬화)
     * 2. 장바구니 항목 비관적 락 조회, 비어 있으면 EmptyCartException
     * 3. 카탈로그 가격으로 항목 금액 계산 (찾을 수 없는 상품은 제외)
     * 4. 주문 + 주문 항목 저장 (단가 스냅샷)
     * 5. 장바구니 비우기
     *
     * 3~5단계 중 하나라도 실패하면 전체가 롤백된다.
     * 같은 사용자의 동시 요청은 1단계에서 대기하며, 뒤따르는 요청은 빈 장바구니를 보게 된다.
     *
     * 동시성 제어:
     * - PessimisticLockingFailureException(락 타임아웃, 데드락) 발생 시 재시도
     * - maxAttempts=3, Exponential Backoff with Jitter (50ms → 100ms, 최대 1초)
     * - 재시도마다 새 트랜잭션으로 실행된다 (재시도 프록시가 트랜잭션 프록시 바깥)
     *
     * @param userId 주문자 ID
     * @param paymentMode 검증된 결제 수단
     * @param deliveryLocation 검증된 배송지
     * @return 저장된 주문 (항목 포함)
     * @throws UserNotFoundException 사용자 없음
     * @throws EmptyCartException 장바구니가 비어 있음
     * @throws SystemException 락 재시도 초과 (LOCK_ACQUISITION_FAILED)
     */
    @Transactional(
        propagation = Propagation.REQUIRED,
        rollbackFor = Exception.class
    )
    @Retryable(
        retryFor = PessimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(
            delay = 50,
            multiplier = 2,
            maxDelay = 1000,
            random = true
        )
    )
    public Order placeOrder(Long userId, String paymentMode, String deliveryLocation) {
        userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));

        List<CartItem> cartItems = cartRepository.findAllByUserIdForUpdate(userId);
        if (cartItems.isEmpty()) {
            throw new EmptyCartException(userId);
        }

        PricedCart pricedCart = cartPricingCalculator.price(cartItems);
        if (pricedCart.hasUnresolved()) {
            log.warn("[OrderTransactionService] 카탈로그에 없는 상품 {}건을 제외하고 주문 생성: userId={}",
                    pricedCart.getUnresolved().size(), userId);
        }

        List<OrderItem> orderItems = pricedCart.getLines().stream()
                .map(line -> OrderItem.snapshot(
                        line.getCartItem().getItemRef(),
                        line.getCartItem().getQuantity(),
                        line.getUnitPrice()))
                .collect(Collectors.toList());

        Order order = orderDomainService.assembleOrder(userId, paymentMode, deliveryLocation, orderItems);
        Order savedOrder = orderRepository.save(order);

        int cleared = cartRepository.deleteAllByUserId(userId);

        log.info("[OrderTransactionService] 주문 생성 완료: orderId={}, userId={}, items={}, totalAmount={}, clearedCartItems={}",
                savedOrder.getOrderId(), userId, savedOrder.getOrderItemCount(), savedOrder.getTotalAmount(), cleared);
        return savedOrder;
    }

    /**
     * 락 재시도 초과 복구 (@Recover)
     * maxAttempts를 모두 실패하면 시스템 예외로 변환한다.
     */
    @Recover
    public Order recoverLockFailure(PessimisticLockingFailureException exception,
                                    Long userId,
                                    String paymentMode,
                                    String deliveryLocation) {
        log.error("[OrderTransactionService] 락 획득 재시도 초과 - userId={}, maxAttempts=3 모두 실패", userId, exception);
        throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, exception);
    }

    /**
     * 재시도 대상이 아닌 예외는 그대로 호출자에게 전달
     */
    @Recover
    public Order rethrow(RuntimeException exception,
                         Long userId,
                         String paymentMode,
                         String deliveryLocation) {
        throw exception;
    }
}
