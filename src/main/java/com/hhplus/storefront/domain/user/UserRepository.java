package com.hhplus.storefront.domain.user;

import java.util.Optional;

/**
 * User Repository Interface (Domain Layer - Port)
 */
public interface UserRepository {

    User save(User user);

    Optional<User> findById(Long userId);

    /**
     * 사용자를 비관적 락으로 조회 (SELECT ... FOR UPDATE)
     * 같은 사용자의 주문 생성을 직렬화하는 데 사용한다.
     */
    Optional<User> findByIdForUpdate(Long userId);

    boolean existsById(Long userId);

    boolean existsByMobile(String mobile);

    boolean existsByEmail(String email);
}
