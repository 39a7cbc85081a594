package com.hhplus.storefront.application.user.dto;

import com.hhplus.storefront.domain.user.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 사용자 정보 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResult {
    private Long userId;
    private String fullName;
    private String mobile;
    private String email;
    private String location;
    private LocalDateTime createdAt;

    public static UserResult from(User user) {
        return UserResult.builder()
                .userId(user.getUserId())
                .fullName(user.getFullName())
                .mobile(user.getMobile())
                .email(user.getEmail())
                .location(user.getLocation())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
