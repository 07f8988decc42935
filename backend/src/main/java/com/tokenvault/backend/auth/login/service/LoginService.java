package com.tokenvault.backend.auth.login.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;

import com.tokenvault.backend.auth.audit.SecurityAudit;
import com.tokenvault.backend.auth.config.AuthProperties;
import com.tokenvault.backend.auth.token.domain.RefreshToken;
import com.tokenvault.backend.auth.token.dto.TokenResponse;
import com.tokenvault.backend.auth.token.service.RefreshTokenService;
import com.tokenvault.backend.auth.user.User;
import com.tokenvault.backend.auth.user.UserDirectory;
import com.tokenvault.backend.global.ApiException;
import com.tokenvault.backend.global.ErrorCode;
import com.tokenvault.backend.security.AccessTokenSubject;
import com.tokenvault.backend.security.IssuedAccessToken;
import com.tokenvault.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 유스케이스 (@Service 계층)
 *  : 인증(비번 검증) + 계정 상태 정책(ACTIVE) + 토큰 쌍 발급
 *
 * - JwtService: Access Token 발급 (새 jti)
 * - RefreshTokenService: 그 jti 와 짝인 Refresh Token 발급 + 서버 저장 (동시 세션 제한 포함)
 *
 * 없는 유저 / 비밀번호 불일치는 같은 INVALID_CREDENTIALS 로 뭉갠다. (계정 존재 여부 노출 방지)
 *
 * 잠금: 비밀번호가 lockout.maxFailedAttempts 번 틀리면 lockout.durationSeconds 동안 ACCOUNT_LOCKED.
 * 잠금 확인은 비밀번호 검증보다 먼저 한다. 잠긴 동안의 시도는 맞든 틀리든 같은 응답이고 카운트하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final UserDirectory userDirectory;
    private final JwtService jwtService;
    private final RefreshTokenService refreshTokenService;
    private final SecurityAudit audit;
    private final AuthProperties props;
    private final Clock clock;

    public TokenResponse login(String username, String rawPassword, String ip, String deviceInfo) {

        User user = userDirectory.findByName(username).orElse(null);
        if (user == null) {
            audit.record(sink -> sink.authFailure(username, ip, "Unknown user"));
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        AuthProperties.Lockout lockout = props.lockout();

        if (lockout.enabled() && user.isLockedOut(now)) {
            log.warn("Login rejected for user {}: locked out until {}", user.getId(), user.getLockoutEnd());
            audit.record(sink -> sink.authFailure(username, ip, "Account locked out"));
            throw new ApiException(ErrorCode.ACCOUNT_LOCKED);
        }

        if (!userDirectory.checkPassword(user, rawPassword)) {
            if (lockout.enabled()) {
                boolean locked = user.recordFailedLogin(now, lockout.maxFailedAttempts(),
                        Duration.ofSeconds(lockout.durationSeconds()));
                userDirectory.update(user);
                if (locked)
                    log.warn("User {} locked out until {}", user.getId(), user.getLockoutEnd());
            }
            audit.record(sink -> sink.authFailure(username, ip, "Invalid password"));
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        // 비밀번호가 맞아도 ACTIVE 가 아니면 거절 (여기서는 상태를 알려줘도 됨)
        if (!user.isActive()) {
            audit.record(sink -> sink.authFailure(username, ip, "Account disabled"));
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }

        user.recordSuccessfulLogin(now);
        user = userDirectory.update(user);

        /**
         * Access Token 발급(JWT) -> jti 확보
         * Refresh Token 은 이 jti 와 짝으로 저장된다. (재발급 때 짝이 맞는지 확인)
         */
        IssuedAccessToken access = jwtService.issue(
                AccessTokenSubject.of(user, userDirectory.getRoles(user)));

        RefreshToken refresh = refreshTokenService
                .create(user.getId(), access.jwtId(), ip, deviceInfo)
                .orElse(null);
        if (refresh == null) {
            log.error("Login failed for user {}: refresh token could not be created", user.getId());
            throw new ApiException(ErrorCode.AUTH_FAILED);
        }

        String userId = String.valueOf(user.getId());
        audit.record(sink -> sink.authSuccess(userId, ip));
        return TokenResponse.of(access, refresh);
    }
}
