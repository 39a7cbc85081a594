package com.hhplus.storefront.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Spring Retry 설정
 *
 * 역할:
 * - @Retryable, @Recover 어노테이션 활성화
 * - 주문 생성 시 비관적 락 획득 실패(락 타임아웃, 데드락)를 제한된 횟수로 재시도
 *
 * 재시도 프록시는 트랜잭션 프록시보다 바깥에서 동작하므로 시도마다 새 트랜잭션이 시작된다.
 */
@Configuration
@EnableRetry
public class RetryConfig {
    // @Retryable, @Recover 어노테이션은 각 메서드에서 정의
}
