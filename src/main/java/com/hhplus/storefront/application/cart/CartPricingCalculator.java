package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.application.catalog.CatalogLookup;
import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.catalog.CatalogItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CartPricingCalculator - 장바구니 가격 계산 (Application 계층)
 *
 * 장바구니 화면과 주문 생성이 같은 규칙으로 금액을 계산하도록 공유된다.
 * - 항목 금액 = 상품 finalPrice × 수량
 * - 총액 = 해석된 항목 금액의 합
 * - 카탈로그에서 찾을 수 없는 항목은 목록과 합계에서 제외하고 WARN 로그를 남긴다
 */
@Component
public class CartPricingCalculator {

    private static final Logger log = LoggerFactory.getLogger(CartPricingCalculator.class);

    private final CatalogLookup catalogLookup;

    public CartPricingCalculator(CatalogLookup catalogLookup) {
        this.catalogLookup = catalogLookup;
    }

    public PricedCart price(List<CartItem> cartItems) {
        List<PricedCartLine> lines = new ArrayList<>();
        List<CartItem> unresolved = new ArrayList<>();

        for (CartItem cartItem : cartItems) {
            Optional<CatalogItem> catalogItem = catalogLookup.resolve(cartItem.getItemRef());
            if (catalogItem.isPresent()) {
                lines.add(new PricedCartLine(cartItem, catalogItem.get()));
            } else {
                log.warn("[CartPricing] 카탈로그에 없는 상품 제외: cartItemId={}, userId={}, item={}",
                        cartItem.getCartItemId(), cartItem.getUserId(), cartItem.getItemRef());
                unresolved.add(cartItem);
            }
        }

        return new PricedCart(lines, unresolved);
    }
}
