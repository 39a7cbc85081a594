package com.hhplus.storefront.presentation.user.mapper;

import com.hhplus.storefront.application.user.dto.RegisterUserCommand;
import com.hhplus.storefront.application.user.dto.UpdateProfileCommand;
import com.hhplus.storefront.application.user.dto.UserResult;
import com.hhplus.storefront.presentation.user.request.RegisterUserRequest;
import com.hhplus.storefront.presentation.user.request.UpdateProfileRequest;
import com.hhplus.storefront.presentation.user.response.UserResponse;
import org.springframework.stereotype.Component;

/**
 * UserMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class UserMapper {

    public RegisterUserCommand toRegisterUserCommand(RegisterUserRequest request) {
        return RegisterUserCommand.builder()
                .fullName(request.getFullName())
                .mobile(request.getMobile())
                .email(request.getEmail())
                .location(request.getLocation())
                .build();
    }

    public UpdateProfileCommand toUpdateProfileCommand(UpdateProfileRequest request) {
        return UpdateProfileCommand.builder()
                .fullName(request.getFullName())
                .email(request.getEmail())
                .location(request.getLocation())
                .build();
    }

    public UserResponse toUserResponse(UserResult result) {
        return UserResponse.builder()
                .userId(result.getUserId())
                .fullName(result.getFullName())
                .mobile(result.getMobile())
                .email(result.getEmail())
                .location(result.getLocation())
                .createdAt(result.getCreatedAt())
                .build();
    }
}
