package com.hhplus.storefront.domain.order;

import lombok.Getter;

/**
 * OrderStatus - 도메인 값 객체 (Enum)
 *
 * 주문은 PENDING 상태로만 생성되며, 이후 상태 전환은 이 서비스에서 다루지 않는다.
 */
@Getter
public enum OrderStatus {
    PENDING("Pending", "주문 대기");

    private final String code;
    private final String displayName;

    OrderStatus(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }
}
