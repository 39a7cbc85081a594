package com.hhplus.storefront.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 * 주문 데이터의 저장 및 조회를 담당
 */
public interface OrderRepository {
    /**
     * 주문 저장 (항목 함께 저장)
     */
    Order save(Order order);

    /**
     * 주문 ID로 조회 (항목 함께 로드)
     */
    Optional<Order> findById(Long orderId);

    /**
     * 사용자의 주문 목록 조회 (항목 함께 로드, 최신순)
     */
    List<Order> findAllByUserIdWithItems(Long userId);

    /**
     * 사용자의 주문 개수
     */
    long countByUserId(Long userId);
}
