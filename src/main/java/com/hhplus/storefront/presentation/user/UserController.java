package com.hhplus.storefront.presentation.user;

import com.hhplus.storefront.application.user.UserService;
import com.hhplus.storefront.application.user.dto.UserResult;
import com.hhplus.storefront.presentation.user.mapper.UserMapper;
import com.hhplus.storefront.presentation.user.request.RegisterUserRequest;
import com.hhplus.storefront.presentation.user.request.UpdateProfileRequest;
import com.hhplus.storefront.presentation.user.response.UserResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * UserController - Presentation 계층
 * 회원가입 및 프로필 API 요청 처리
 */
@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;
    private final UserMapper userMapper;

    public UserController(UserService userService, UserMapper userMapper) {
        this.userService = userService;
        this.userMapper = userMapper;
    }

    /**
     * POST /users - 회원가입
     */
    @PostMapping
    public ResponseEntity<UserResponse> register(@RequestBody RegisterUserRequest request) {
        UserResult result = userService.register(userMapper.toRegisterUserCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(userMapper.toUserResponse(result));
    }

    /**
     * GET /users/me - 내 프로필 조회
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> getProfile(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(userMapper.toUserResponse(userService.getProfile(userId)));
    }

    /**
     * PATCH /users/me - 프로필 수정 (이름, 이메일, 주소)
     */
    @PatchMapping("/me")
    public ResponseEntity<UserResponse> updateProfile(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody UpdateProfileRequest request) {
        UserResult result = userService.updateProfile(userId, userMapper.toUpdateProfileCommand(request));
        return ResponseEntity.ok(userMapper.toUserResponse(result));
    }
}
