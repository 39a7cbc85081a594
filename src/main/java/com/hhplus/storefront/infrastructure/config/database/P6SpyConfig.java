package com.hhplus.storefront.infrastructure.config.database;

import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * P6Spy 설정 클래스
 *
 * test 프로필에서만 활성화되며, 바인딩 값이 채워진 SQL을 P6SpyPrettySqlFormatter로 출력한다.
 * 주문 생성 시 FOR UPDATE 쿼리와 장바구니 일괄 삭제를 확인하는 용도.
 */
@Configuration
@Profile("test")
public class P6SpyConfig {

    @Bean
    public MessageFormattingStrategy p6SpyMessageFormattingStrategy() {
        return new P6SpyPrettySqlFormatter();
    }
}
