package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.domain.catalog.ItemRef;

import java.util.List;
import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 *
 * 목록 조회는 항상 (상품 유형, 상품 ID, 항목 ID) 순으로 정렬된다.
 */
public interface CartRepository {

    /**
     * 장바구니 항목 ID로 조회
     */
    Optional<CartItem> findById(Long cartItemId);

    /**
     * 사용자의 장바구니에서 특정 상품 항목 조회
     * 중복 항목 확인 및 수량 누적 처리용
     */
    Optional<CartItem> findByUserIdAndItem(Long userId, ItemRef itemRef);

    /**
     * 사용자의 모든 장바구니 항목 조회
     */
    List<CartItem> findAllByUserId(Long userId);

    /**
     * 사용자의 모든 장바구니 항목을 비관적 락으로 조회 (주문 생성용)
     */
    List<CartItem> findAllByUserIdForUpdate(Long userId);

    /**
     * 장바구니 항목 저장 (생성 또는 수정)
     */
    CartItem save(CartItem cartItem);

    /**
     * 장바구니 항목 삭제
     */
    void delete(CartItem cartItem);

    /**
     * 사용자의 장바구니 비우기
     *
     * @return 삭제된 항목 수
     */
    int deleteAllByUserId(Long userId);
}
