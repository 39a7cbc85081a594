package com.hhplus.storefront.domain.user;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * User 도메인 엔티티
 *
 * 주문 흐름에서는 다음 용도로 읽는다.
 * - 사용자 존재 확인
 * - 주문 생성 직렬화 (사용자 행 비관적 락)
 * - 배송지 미입력 시 기본 배송지 제공
 *
 * 회원가입과 프로필 수정(이름, 이메일, 주소)은 UserService가 처리한다.
 * 휴대폰 번호는 가입 후 변경할 수 없다.
 * 비밀번호, 프로필 사진은 외부 인증 계층의 책임이다.
 */
@Entity
@Table(name = "users")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    @Column(name = "mobile", nullable = false, unique = true, length = 15)
    private String mobile;

    @Column(name = "email", nullable = false, unique = true, length = 100)
    private String email;

    @Column(name = "location", length = 200)
    private String location;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static final int FULL_NAME_MAX_LENGTH = 100;
    public static final int MOBILE_MAX_LENGTH = 15;
    public static final int EMAIL_MAX_LENGTH = 100;
    public static final int LOCATION_MAX_LENGTH = 200;

    /**
     * 사용자 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 이름, 휴대폰 번호, 이메일은 필수
     * - 주소는 선택 (없으면 주문 시 배송지를 직접 입력해야 함)
     * - 각 값은 컬럼 길이를 넘을 수 없음
     *
     * @throws InvalidUserRequestException 필수값 누락 또는 길이 초과
     */
    public static User create(String fullName, String mobile, String email, String location) {
        requireText("full_name", fullName, FULL_NAME_MAX_LENGTH);
        requireText("mobile", mobile, MOBILE_MAX_LENGTH);
        requireText("email", email, EMAIL_MAX_LENGTH);
        if (location != null && location.length() > LOCATION_MAX_LENGTH) {
            throw new InvalidUserRequestException("location 길이 초과: " + location.length());
        }

        return User.builder()
                .fullName(fullName.trim())
                .mobile(mobile.trim())
                .email(email.trim())
                .location(location)
                .createdAt(LocalDateTime.now())
                .build();
    }

    /**
     * 회원가입 팩토리 메서드
     * 가입 양식에서는 주소까지 필수로 받는다.
     *
     * @throws InvalidUserRequestException 필수값 누락 또는 길이 초과
     */
    public static User register(String fullName, String mobile, String email, String location) {
        requireText("location", location, LOCATION_MAX_LENGTH);
        return create(fullName, mobile, email, location.trim());
    }

    /**
     * 프로필 수정
     * null인 값은 변경하지 않는다. 빈 문자열은 허용하지 않는다.
     *
     * @throws InvalidUserRequestException 빈 값 또는 길이 초과
     */
    public void updateProfile(String fullName, String email, String location) {
        if (fullName != null) {
            requireText("full_name", fullName, FULL_NAME_MAX_LENGTH);
        }
        if (email != null) {
            requireText("email", email, EMAIL_MAX_LENGTH);
        }
        if (location != null) {
            requireText("location", location, LOCATION_MAX_LENGTH);
        }

        if (fullName != null) {
            this.fullName = fullName.trim();
        }
        if (email != null) {
            this.email = email.trim();
        }
        if (location != null) {
            this.location = location.trim();
        }
    }

    public boolean hasEmail(String email) {
        return email != null && this.email.equalsIgnoreCase(email.trim());
    }

    public boolean hasLocation() {
        return this.location != null && !this.location.isBlank();
    }

    private static void requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new InvalidUserRequestException(field + " 필수");
        }
        if (value.trim().length() > maxLength) {
            throw new InvalidUserRequestException(field + " 길이 초과: " + value.trim().length());
        }
    }
}
