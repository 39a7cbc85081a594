package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.domain.common.AmountOverflowException;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order 도메인 엔티티
 *
 * 책임:
 * - 주문 헤더 정보(결제 수단, 배송지, 총액, 상태) 보존
 * - 주문 항목 스냅샷 소유
 *
 * 핵심 비즈니스 규칙:
 * - 주문은 PENDING 상태로 생성되며 생성 후 변경되지 않는다
 * - totalAmount == Σ(항목 수량 × 항목 단가)
 * - 항목이 하나도 없어도 주문은 생성될 수 있다 (총액 0)
 *   장바구니의 모든 상품이 카탈로그에서 삭제된 경우
 */
@Entity
@Table(name = "orders")
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "total_amount", nullable = false, updatable = false)
    private Long totalAmount;

    @Column(name = "payment_mode", nullable = false, length = 20, updatable = false)
    private String paymentMode;

    @Column(name = "delivery_location", nullable = false, length = 500, updatable = false)
    private String deliveryLocation;

    @Column(name = "order_status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus orderStatus;

    @Column(name = "order_date", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 주문 항목 관계
     * 주문과 생명주기를 같이 하므로 ALL + orphanRemoval
     */
    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    @OrderBy("orderItemId ASC")
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드
     *
     * 총액은 전달된 항목 스냅샷에서 계산한다.
     *
     * @param userId 주문자 ID
     * @param paymentMode 결제 수단
     * @param deliveryLocation 배송지
     * @param items 주문 항목 스냅샷 (비어 있을 수 있음)
     * @return PENDING 상태의 Order
     * @throws AmountOverflowException 총액이 long 범위를 넘는 경우
     */
    public static Order create(Long userId, String paymentMode, String deliveryLocation, List<OrderItem> items) {
        if (userId == null) {
            throw new IllegalArgumentException("주문자 ID는 필수입니다");
        }
        if (items == null) {
            throw new IllegalArgumentException("주문 항목 목록은 null이 될 수 없습니다");
        }

        long total = OrderConstants.ZERO_TOTAL;
        try {
            for (OrderItem item : items) {
                total = Math.addExact(total, item.getLineTotal());
            }
        } catch (ArithmeticException e) {
            throw new AmountOverflowException("order total, items=" + items.size(), e);
        }

        Order order = Order.builder()
                .userId(userId)
                .paymentMode(paymentMode)
                .deliveryLocation(deliveryLocation)
                .totalAmount(total)
                .orderStatus(OrderStatus.PENDING)
                .createdAt(LocalDateTime.now())
                .build();
        order.orderItems.addAll(items);
        return order;
    }

    public List<OrderItem> getOrderItems() {
        return Collections.unmodifiableList(orderItems);
    }

    /**
     * 주문 항목 개수
     */
    public int getOrderItemCount() {
        return this.orderItems.size();
    }
}
