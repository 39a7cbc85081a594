package com.hhplus.storefront.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_CART_EMPTY, SYSTEM_LOCK_ACQUISITION_FAILED
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // User Domain
    USER_NOT_FOUND("DOMAIN_USER_NOT_FOUND", "사용자를 찾을 수 없습니다", 404),
    USER_DUPLICATE("DOMAIN_USER_DUPLICATE", "이미 등록된 휴대폰 번호 또는 이메일입니다", 409),
    USER_INVALID_REQUEST("DOMAIN_USER_INVALID_REQUEST", "유효하지 않은 사용자 정보입니다", 400),

    // Catalog Domain
    CATALOG_ITEM_NOT_FOUND("DOMAIN_CATALOG_ITEM_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    CATALOG_INVALID_ITEM_TYPE("DOMAIN_CATALOG_INVALID_ITEM_TYPE", "유효하지 않은 상품 유형입니다", 400),

    // Cart Domain
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    CART_ACCESS_DENIED("DOMAIN_CART_ACCESS_DENIED", "다른 사용자의 장바구니 항목입니다", 403),
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "수량은 1 이상의 정수여야 합니다", 400),
    CART_INVALID_ITEM_ID("DOMAIN_CART_INVALID_ITEM_ID", "상품 ID는 1 이상의 정수여야 합니다", 400),

    // Order Domain
    ORDER_INVALID_REQUEST("DOMAIN_ORDER_INVALID_REQUEST", "유효하지 않은 주문 요청입니다", 400),

    // Pricing
    AMOUNT_OVERFLOW("DOMAIN_AMOUNT_OVERFLOW", "금액이 허용 범위를 초과합니다. 수량을 줄여주세요", 400),

    // ========== System Errors (5XX) ==========

    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "락 획득에 실패했습니다. 잠시 후 다시 시도해주세요", 500),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
