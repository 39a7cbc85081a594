package com.hhplus.storefront.infrastructure.config;

import com.hhplus.storefront.domain.order.OrderDomainService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * DomainServiceConfig - Domain Services를 Spring Bean으로 등록
 *
 * Domain Service는 순수 비즈니스 로직만 포함하므로 Spring 어노테이션을 두지 않고
 * 여기서 Bean으로 등록해 Application Service에 주입한다.
 */
@Configuration
public class DomainServiceConfig {

    @Bean
    public OrderDomainService orderDomainService() {
        return new OrderDomainService();
    }
}
