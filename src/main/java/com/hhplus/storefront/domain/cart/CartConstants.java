package com.hhplus.storefront.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 */
public class CartConstants {

    /** 수량을 생략했을 때 담기는 수량 (요청 문자열) */
    public static final String DEFAULT_QUANTITY = "1";

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
