package com.hhplus.storefront.common;

import org.springframework.test.context.TestPropertySource;

/**
 * BaseControllerTest - Controller 계층 테스트 기본 클래스
 *
 * - spring.web.resources.add-mappings=false로 정적 리소스 매핑 비활성화
 * - Controller 단위 테스트는 MockMvcBuilders.standaloneSetup(controller)로 MockMvc를 직접 구성한다
 * - standalone 구성에서는 /api 접두사가 붙지 않으므로 컨트롤러 매핑 경로 그대로 요청한다
 * - GlobalExceptionHandler는 setControllerAdvice로 등록해 에러 응답 형식까지 검증한다
 */
@TestPropertySource(properties = {
    "spring.web.resources.add-mappings=false"
})
public abstract class BaseControllerTest {

    protected static final String USER_HEADER = "X-USER-ID";
}
