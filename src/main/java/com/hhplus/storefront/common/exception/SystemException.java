package com.hhplus.storefront.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 역할:
 * - 데이터베이스 락 획득 실패 등 인프라 오류
 * - 항상 서버 오류(5XX)로 응답
 *
 * 특징:
 * - 클라이언트 재시도 가능성 있음
 * - 모니터링 필요
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
