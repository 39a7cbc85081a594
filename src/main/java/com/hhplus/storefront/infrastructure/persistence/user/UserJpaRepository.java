package com.hhplus.storefront.infrastructure.persistence.user;

import com.hhplus.storefront.domain.user.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * User JPA Repository
 * Spring Data JPA를 통한 User 엔티티 영구 저장소
 *
 * Lock 전략:
 * - findByIdForUpdate(): 같은 사용자의 주문 생성을 직렬화 (비관적 락)
 */
public interface UserJpaRepository extends JpaRepository<User, Long> {

    boolean existsByMobile(String mobile);

    boolean existsByEmail(String email);

    /**
     * 사용자를 비관적 락으로 조회
     *
     * 동시성 제어:
     * - SELECT ... FOR UPDATE로 DB 레벨 exclusive lock 획득
     * - 같은 사용자의 두 번째 주문 요청은 첫 요청의 커밋까지 대기한 뒤 비워진 장바구니를 본다
     *
     * 사용처:
     * - OrderTransactionService.placeOrder()
     *
     * @param userId 사용자 ID
     * @return 비관적 락으로 획득된 사용자 정보
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.userId = :userId")
    Optional<User> findByIdForUpdate(@Param("userId") Long userId);
}
