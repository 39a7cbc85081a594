package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.catalog.ItemType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CartItem JPA Repository
 * Spring Data JPA를 통한 cart 테이블 저장소
 */
public interface CartItemJpaRepository extends JpaRepository<CartItem, Long> {

    Optional<CartItem> findByUserIdAndItemTypeAndItemId(Long userId, ItemType itemType, Long itemId);

    @Query("SELECT c FROM CartItem c " +
           "WHERE c.userId = :userId " +
           "ORDER BY c.itemType ASC, c.itemId ASC, c.cartItemId ASC")
    List<CartItem> findAllByUserIdOrdered(@Param("userId") Long userId);

    /**
     * 사용자의 장바구니 항목을 비관적 락으로 조회
     *
     * SQL 생성:
     * SELECT ... FROM cart c WHERE c.user_id=? ORDER BY ... FOR UPDATE
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CartItem c " +
           "WHERE c.userId = :userId " +
           "ORDER BY c.itemType ASC, c.itemId ASC, c.cartItemId ASC")
    List<CartItem> findAllByUserIdForUpdate(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM CartItem c WHERE c.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);
}
