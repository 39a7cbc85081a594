package com.hhplus.storefront.application.user;

import com.hhplus.storefront.application.user.dto.RegisterUserCommand;
import com.hhplus.storefront.application.user.dto.UpdateProfileCommand;
import com.hhplus.storefront.application.user.dto.UserResult;
import com.hhplus.storefront.domain.user.DuplicateUserException;
import com.hhplus.storefront.domain.user.InvalidUserRequestException;
import com.hhplus.storefront.domain.user.User;
import com.hhplus.storefront.domain.user.UserNotFoundException;
import com.hhplus.storefront.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * UserService - Application 계층
 * 회원가입, 프로필 조회/수정
 *
 * 휴대폰 번호와 이메일은 사용자 간에 유일해야 한다.
 * 사전 조회로 중복을 거르고, 동시 가입으로 유니크 제약에 걸린 경우도 같은 예외로 변환한다.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;

    public UserService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * 회원가입
     *
     * @throws InvalidUserRequestException 필수값 누락 또는 길이 초과
     * @throws DuplicateUserException 이미 등록된 휴대폰 번호 또는 이메일
     */
    @Transactional
    public UserResult register(RegisterUserCommand command) {
        User user = User.register(command.getFullName(), command.getMobile(), command.getEmail(), command.getLocation());

        if (userRepository.existsByMobile(user.getMobile())) {
            throw new DuplicateUserException("mobile");
        }
        if (userRepository.existsByEmail(user.getEmail())) {
            throw new DuplicateUserException("email");
        }

        User saved;
        try {
            saved = userRepository.save(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("[UserService] 가입 중 유니크 제약 위반: mobile={}", user.getMobile());
            throw new DuplicateUserException("mobile|email", e);
        }

        log.info("[UserService] 회원가입 완료: userId={}", saved.getUserId());
        return UserResult.from(saved);
    }

    /**
     * 프로필 조회
     *
     * @throws UserNotFoundException 사용자 없음
     */
    @Transactional(readOnly = true)
    public UserResult getProfile(Long userId) {
        return UserResult.from(findUser(userId));
    }

    /**
     * 프로필 수정 (이름, 이메일, 주소)
     * null인 값은 변경하지 않는다. 휴대폰 번호는 변경할 수 없다.
     *
     * @throws UserNotFoundException 사용자 없음
     * @throws InvalidUserRequestException 빈 값 또는 길이 초과
     * @throws DuplicateUserException 다른 사용자가 사용 중인 이메일
     */
    @Transactional
    public UserResult updateProfile(Long userId, UpdateProfileCommand command) {
        User user = findUser(userId);

        String email = command.getEmail();
        if (email != null && !email.isBlank() && !user.hasEmail(email)
                && userRepository.existsByEmail(email.trim())) {
            throw new DuplicateUserException("email");
        }

        user.updateProfile(command.getFullName(), email, command.getLocation());

        User saved;
        try {
            saved = userRepository.save(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("[UserService] 프로필 수정 중 유니크 제약 위반: userId={}", userId);
            throw new DuplicateUserException("email", e);
        }

        log.info("[UserService] 프로필 수정 완료: userId={}", userId);
        return UserResult.from(saved);
    }

    private User findUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }
}
