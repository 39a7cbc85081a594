package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.domain.user.User;

import java.util.List;

/**
 * 주문 도메인 서비스
 *
 * 주문서 검증과 주문 조립을 담당한다. 저장소에 의존하지 않는 순수 로직이다.
 */
public class OrderDomainService {

    /**
     * 배송지 결정
     * 요청 배송지가 비어 있으면 사용자의 등록 주소를 사용한다.
     *
     * @param requested 요청 배송지 (nullable)
     * @param user 주문자
     * @return 앞뒤 공백을 제거한 배송지, 둘 다 없으면 null
     */
    public String resolveDeliveryLocation(String requested, User user) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        if (user != null && user.hasLocation()) {
            return user.getLocation().trim();
        }
        return null;
    }

    /**
     * 주문서 입력값 검증
     *
     * @throws InvalidOrderRequestException 결제 수단/배송지 누락 또는 길이 초과
     */
    public void validateOrderRequest(String paymentMode, String deliveryLocation) {
        if (paymentMode == null || paymentMode.isBlank()) {
            throw new InvalidOrderRequestException("결제 수단은 필수입니다");
        }
        if (paymentMode.trim().length() > OrderConstants.MAX_PAYMENT_MODE_LENGTH) {
            throw new InvalidOrderRequestException(
                    "결제 수단은 " + OrderConstants.MAX_PAYMENT_MODE_LENGTH + "자 이하여야 합니다");
        }
        if (deliveryLocation == null || deliveryLocation.isBlank()) {
            throw new InvalidOrderRequestException("배송지는 필수입니다");
        }
        if (deliveryLocation.length() > OrderConstants.MAX_DELIVERY_LOCATION_LENGTH) {
            throw new InvalidOrderRequestException(
                    "배송지는 " + OrderConstants.MAX_DELIVERY_LOCATION_LENGTH + "자 이하여야 합니다");
        }
    }

    /**
     * 주문 조립
     *
     * @param userId 주문자 ID
     * @param paymentMode 검증된 결제 수단
     * @param deliveryLocation 검증된 배송지
     * @param items 가격이 확정된 주문 항목
     * @return PENDING 상태의 주문
     */
    public Order assembleOrder(Long userId, String paymentMode, String deliveryLocation, List<OrderItem> items) {
        return Order.create(userId, paymentMode.trim(), deliveryLocation, items);
    }
}
