package com.hhplus.storefront.domain.common.vo;

import java.io.Serializable;
import java.util.Objects;

/**
 * Quantity Value Object
 *
 * 수량 관련 정보를 나타내는 값 객체입니다.
 * 1 이상의 정수만 허용하며, 상한은 두지 않습니다.
 *
 * 사용처:
 * - CartItem (장바구니 수량 누적)
 * - 장바구니 추가 요청의 수량 문자열 파싱
 *
 * 특징:
 * - Immutable: 생성 후 변경 불가능
 * - 연산 결과는 새로운 Quantity 객체 반환
 * - equals/hashCode 구현으로 값 비교 가능
 */
public final class Quantity implements Comparable<Quantity>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final Quantity ONE = new Quantity(1);

    private final int quantity;

    /**
     * Quantity 객체를 생성합니다.
     *
     * @param quantity 수량 (1 이상이어야 함)
     * @throws IllegalArgumentException quantity < 1인 경우
     */
    public Quantity(int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다: " + quantity);
        }
        this.quantity = quantity;
    }

    public static Quantity of(int quantity) {
        return new Quantity(quantity);
    }

    /**
     * 외부 입력 문자열을 수량으로 변환합니다.
     * 앞뒤 공백은 허용하며, 정수가 아니거나 1 미만이면 거부합니다.
     *
     * @param raw 수량 문자열
     * @return Quantity
     * @throws IllegalArgumentException 파싱 실패 또는 1 미만
     */
    public static Quantity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("수량이 비어 있습니다");
        }
        try {
            return new Quantity(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("수량은 정수여야 합니다: " + raw, e);
        }
    }

    public int getQuantity() {
        return quantity;
    }

    /**
     * 현재 수량에 다른 수량을 더합니다.
     *
     * @param other 더할 수량
     * @return 더한 결과를 나타내는 새로운 Quantity 객체
     * @throws ArithmeticException int 범위를 넘는 경우
     */
    public Quantity add(Quantity other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return new Quantity(Math.addExact(this.quantity, other.quantity));
    }

    @Override
    public int compareTo(Quantity other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return Integer.compare(this.quantity, other.quantity);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Quantity)) {
            return false;
        }
        Quantity other = (Quantity) obj;
        return this.quantity == other.quantity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(quantity);
    }

    @Override
    public String toString() {
        return String.format("Quantity(%d)", quantity);
    }
}
