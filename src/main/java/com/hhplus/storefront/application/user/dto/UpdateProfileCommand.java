package com.hhplus.storefront.application.user.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 프로필 수정 커맨드 (Application layer 내부 DTO)
 * null인 필드는 변경하지 않는다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProfileCommand {
    private String fullName;
    private String email;
    private String location;
}
