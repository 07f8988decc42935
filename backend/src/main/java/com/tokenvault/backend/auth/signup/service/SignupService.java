package com.tokenvault.backend.auth.signup.service;

import java.util.List;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.tokenvault.backend.auth.audit.SecurityAudit;
import com.tokenvault.backend.auth.signup.dto.SignupRequest;
import com.tokenvault.backend.auth.signup.dto.SignupResponse;
import com.tokenvault.backend.auth.user.User;
import com.tokenvault.backend.auth.user.UserDirectory;
import com.tokenvault.backend.global.ApiException;
import com.tokenvault.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 회원가입 유스케이스
 *
 * 1) 비밀번호 확인 일치
 * 2) 비밀번호 정책 (PasswordPolicyValidator, 위반 사항은 메시지에 모두 담는다)
 * 3) username / email 중복 (사전 조회 + DB unique 제약으로 한 번 더)
 * 4) USER 권한으로 생성 + 감사 로그
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignupService {

    private final UserDirectory userDirectory;
    private final PasswordPolicyValidator passwordPolicy;
    private final SecurityAudit audit;

    public SignupResponse register(SignupRequest req, String ip) {
        if (!req.password().equals(req.passwordConfirm())) {
            throw new ApiException(ErrorCode.PASSWORD_MISMATCH);
        }

        List<String> violations = passwordPolicy.validate(req.password(), req.username(), req.email());
        if (!violations.isEmpty()) {
            log.debug("Signup rejected for username {}: {}", req.username(), violations);
            throw new ApiException(ErrorCode.PASSWORD_POLICY_VIOLATION, String.join("; ", violations));
        }

        if (userDirectory.findByName(req.username()).isPresent()) {
            throw new ApiException(ErrorCode.USERNAME_TAKEN);
        }
        if (userDirectory.findByEmail(req.email()).isPresent()) {
            throw new ApiException(ErrorCode.EMAIL_TAKEN);
        }

        User user;
        try {
            user = userDirectory.register(
                    req.username(),
                    req.email(),
                    req.password(),
                    req.firstName(),
                    req.lastName());
        } catch (DataIntegrityViolationException e) {
            // 동시 가입 경쟁: 사전 조회는 통과했지만 unique 제약에 걸림
            log.warn("Signup raced on unique constraint for username {}", req.username());
            throw new ApiException(ErrorCode.USERNAME_TAKEN);
        }

        String userId = String.valueOf(user.getId());
        audit.record(sink -> sink.registration(userId, ip));
        log.info("Registered user {} ({})", user.getId(), user.getUsername());

        return new SignupResponse(user.getId(), user.getUsername(), user.getEmail());
    }
}
