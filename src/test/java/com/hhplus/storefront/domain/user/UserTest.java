package com.hhplus.storefront.domain.user;

import com.hhplus.storefront.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("User 도메인 테스트")
class UserTest {

    @Test
    @DisplayName("회원가입 - 앞뒤 공백 제거 후 생성")
    void testRegister() {
        User user = User.register(" 김철수 ", "01011112222", "kim@example.com ", " 서울시 강남구");

        assertEquals("김철수", user.getFullName());
        assertEquals("kim@example.com", user.getEmail());
        assertEquals("서울시 강남구", user.getLocation());
        assertNotNull(user.getCreatedAt());
    }

    @Test
    @DisplayName("회원가입 - 이름/휴대폰/이메일/주소 누락 시 400")
    void testRegister_MissingField() {
        InvalidUserRequestException exception = assertThrows(InvalidUserRequestException.class,
                () -> User.register(" ", "01011112222", "kim@example.com", "서울"));
        assertEquals(ErrorCode.USER_INVALID_REQUEST, exception.getErrorCode());

        assertThrows(InvalidUserRequestException.class, () -> User.register("김철수", null, "kim@example.com", "서울"));
        assertThrows(InvalidUserRequestException.class, () -> User.register("김철수", "01011112222", "", "서울"));
        assertThrows(InvalidUserRequestException.class, () -> User.register("김철수", "01011112222", "kim@example.com", null));
    }

    @Test
    @DisplayName("회원가입 - 컬럼 길이 초과")
    void testRegister_TooLong() {
        assertThrows(InvalidUserRequestException.class,
                () -> User.register("a".repeat(101), "01011112222", "kim@example.com", "서울"));
        assertThrows(InvalidUserRequestException.class,
                () -> User.register("김철수", "0".repeat(16), "kim@example.com", "서울"));
        assertThrows(InvalidUserRequestException.class,
                () -> User.register("김철수", "01011112222", "kim@example.com", "서".repeat(201)));
    }

    @Test
    @DisplayName("주소 없이 생성된 사용자는 기본 배송지 없음")
    void testCreate_WithoutLocation() {
        User user = User.create("김철수", "01011112222", "kim@example.com", null);

        assertFalse(user.hasLocation());
    }

    @Test
    @DisplayName("프로필 수정 - null인 값은 유지")
    void testUpdateProfile_PartialUpdate() {
        // Given
        User user = User.register("김철수", "01011112222", "kim@example.com", "서울");

        // When
        user.updateProfile(null, "new@example.com", null);

        // Then
        assertEquals("김철수", user.getFullName());
        assertEquals("new@example.com", user.getEmail());
        assertEquals("서울", user.getLocation());
        assertEquals("01011112222", user.getMobile());
    }

    @Test
    @DisplayName("프로필 수정 - 빈 값이면 예외, 기존 값 유지")
    void testUpdateProfile_BlankField() {
        User user = User.register("김철수", "01011112222", "kim@example.com", "서울");

        assertThrows(InvalidUserRequestException.class, () -> user.updateProfile("박영수", "kim@example.com", " "));

        assertEquals("김철수", user.getFullName());
        assertEquals("서울", user.getLocation());
    }

    @Test
    @DisplayName("이메일 비교는 대소문자 무시")
    void testHasEmail() {
        User user = User.register("김철수", "01011112222", "kim@example.com", "서울");

        assertTrue(user.hasEmail("KIM@example.com"));
        assertFalse(user.hasEmail("lee@example.com"));
        assertFalse(user.hasEmail(null));
    }
}
