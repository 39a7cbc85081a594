package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 * Spring Data JPA를 통한 Order 엔티티 영구 저장소
 *
 * FetchType 정책:
 * - Order.orderItems는 LAZY
 * - 항목이 필요한 조회는 fetch join으로 한 번에 로드 (N+1 방지)
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    /**
     * 사용자별 주문 조회 (최신순, orderItems 함께 로드)
     */
    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems oi " +
           "WHERE o.userId = :userId " +
           "ORDER BY o.createdAt DESC, o.orderId DESC")
    List<Order> findAllByUserIdWithItems(@Param("userId") Long userId);

    /**
     * 주문 ID로 조회 (orderItems 함께 로드)
     */
    @Query("SELECT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems oi " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithItems(@Param("orderId") Long orderId);

    long countByUserId(Long userId);
}
