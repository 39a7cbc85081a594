package com.hhplus.storefront.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 비즈니스 도메인의 규칙 위반 시 발생
 * - 입력값 검증 실패, 권한 없는 접근, 빈 장바구니 주문 등
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - EmptyCartException: 빈 장바구니로 주문 시도
 * - CartAccessDeniedException: 다른 사용자의 장바구니 항목 삭제 시도
 * - InvalidQuantityException: 수량 형식 오류
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
