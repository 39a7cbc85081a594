package com.hhplus.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Storefront 애플리케이션 메인 클래스
 *
 * 서비스/메뉴 카탈로그, 장바구니, 주문 생성 API를 제공한다.
 * 재시도(@EnableRetry)는 RetryConfig에서 활성화한다.
 */
@EnableAspectJAutoProxy
@SpringBootApplication
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }

}
