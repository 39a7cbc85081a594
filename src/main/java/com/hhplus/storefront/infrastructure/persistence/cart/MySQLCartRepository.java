package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.cart.CartRepository;
import com.hhplus.storefront.domain.catalog.ItemRef;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(CartRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
public class MySQLCartRepository implements CartRepository {

    private final CartItemJpaRepository cartItemJpaRepository;

    public MySQLCartRepository(CartItemJpaRepository cartItemJpaRepository) {
        this.cartItemJpaRepository = cartItemJpaRepository;
    }

    @Override
    public Optional<CartItem> findById(Long cartItemId) {
        return cartItemJpaRepository.findById(cartItemId);
    }

    @Override
    public Optional<CartItem> findByUserIdAndItem(Long userId, ItemRef itemRef) {
        return cartItemJpaRepository.findByUserIdAndItemTypeAndItemId(userId, itemRef.getItemType(), itemRef.getItemId());
    }

    @Override
    public List<CartItem> findAllByUserId(Long userId) {
        return cartItemJpaRepository.findAllByUserIdOrdered(userId);
    }

    /**
     * 장바구니 항목 비관적 락 조회
     * 호출하는 트랜잭션이 끝날 때까지 잠금이 유지된다.
     */
    @Override
    @Transactional
    public List<CartItem> findAllByUserIdForUpdate(Long userId) {
        return cartItemJpaRepository.findAllByUserIdForUpdate(userId);
    }

    @Override
    public CartItem save(CartItem cartItem) {
        return cartItemJpaRepository.save(cartItem);
    }

    @Override
    public void delete(CartItem cartItem) {
        cartItemJpaRepository.delete(cartItem);
    }

    @Override
    @Transactional
    public int deleteAllByUserId(Long userId) {
        return cartItemJpaRepository.deleteAllByUserId(userId);
    }
}
