package com.hhplus.storefront.infrastructure.persistence.user;

import com.hhplus.storefront.domain.user.User;
import com.hhplus.storefront.domain.user.UserRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * MySQL 기반 User Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Lock 전략:
 * - findById(): 잠금 없이 조회
 * - findByIdForUpdate(): 비관적 락 (SELECT ... FOR UPDATE)
 */
@Repository
public class MySQLUserRepository implements UserRepository {

    private final UserJpaRepository userJpaRepository;

    public MySQLUserRepository(UserJpaRepository userJpaRepository) {
        this.userJpaRepository = userJpaRepository;
    }

    /**
     * 즉시 flush하여 휴대폰 번호/이메일 유니크 제약 위반을 호출 시점에 DataIntegrityViolationException으로 드러낸다.
     */
    @Override
    public User save(User user) {
        return userJpaRepository.saveAndFlush(user);
    }

    @Override
    public Optional<User> findById(Long userId) {
        return userJpaRepository.findById(userId);
    }

    /**
     * 사용자를 비관적 락으로 조회
     * 호출하는 트랜잭션이 끝날 때까지 잠금이 유지된다.
     */
    @Override
    @Transactional
    public Optional<User> findByIdForUpdate(Long userId) {
        return userJpaRepository.findByIdForUpdate(userId);
    }

    @Override
    public boolean existsById(Long userId) {
        return userJpaRepository.existsById(userId);
    }

    @Override
    public boolean existsByMobile(String mobile) {
        return userJpaRepository.existsByMobile(mobile);
    }

    @Override
    public boolean existsByEmail(String email) {
        return userJpaRepository.existsByEmail(email);
    }
}
