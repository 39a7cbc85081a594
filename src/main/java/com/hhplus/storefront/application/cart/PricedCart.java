package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.common.AmountOverflowException;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 가격 계산이 끝난 장바구니
 *
 * lines: 카탈로그에서 해석된 항목 (금액 합계 대상)
 * unresolved: 카탈로그에서 찾지 못해 제외된 항목
 */
@Getter
public class PricedCart {
    private final List<PricedCartLine> lines;
    private final List<CartItem> unresolved;
    private final long totalAmount;

    PricedCart(List<PricedCartLine> lines, List<CartItem> unresolved) {
        this.lines = Collections.unmodifiableList(lines);
        this.unresolved = Collections.unmodifiableList(unresolved);
        long total = 0L;
        try {
            for (PricedCartLine line : lines) {
                total = Math.addExact(total, line.getLineTotal());
            }
        } catch (ArithmeticException e) {
            throw new AmountOverflowException("cart total, lines=" + lines.size(), e);
        }
        this.totalAmount = total;
    }

    public boolean hasUnresolved() {
        return !unresolved.isEmpty();
    }
}
