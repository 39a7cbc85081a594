package com.hhplus.storefront.domain.order;

/**
 * OrderConstants - 주문 도메인 상수
 *
 * 주문서 입력값 길이 제한은 orders 테이블 컬럼 크기를 따른다.
 */
public class OrderConstants {

    /** 결제 수단 최대 길이 */
    public static final int MAX_PAYMENT_MODE_LENGTH = 20;

    /** 배송지 최대 길이 */
    public static final int MAX_DELIVERY_LOCATION_LENGTH = 500;

    /** 주문 총액 기준값 (0원) */
    public static final long ZERO_TOTAL = 0L;

    private OrderConstants() {
        throw new AssertionError("OrderConstants는 인스턴스화할 수 없습니다");
    }
}
