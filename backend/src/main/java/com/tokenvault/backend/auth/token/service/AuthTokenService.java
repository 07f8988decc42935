package com.tokenvault.backend.auth.token.service;

import java.time.Clock;
import java.time.Duration;

import org.springframework.stereotype.Service;

import com.tokenvault.backend.auth.audit.SecurityAudit;
import com.tokenvault.backend.auth.revocation.RevocationCache;
import com.tokenvault.backend.auth.token.domain.RefreshRevokeReason;
import com.tokenvault.backend.auth.token.domain.RefreshToken;
import com.tokenvault.backend.auth.token.dto.TokenResponse;
import com.tokenvault.backend.auth.user.User;
import com.tokenvault.backend.auth.user.UserDirectory;
import com.tokenvault.backend.global.ApiException;
import com.tokenvault.backend.global.ErrorCode;
import com.tokenvault.backend.global.Result;
import com.tokenvault.backend.security.AccessTokenClaims;
import com.tokenvault.backend.security.AccessTokenSubject;
import com.tokenvault.backend.security.AuthPrincipal;
import com.tokenvault.backend.security.IssuedAccessToken;
import com.tokenvault.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 토큰 유스케이스: 재발급 / 단건 폐기 / 로그아웃
 *
 * RefreshTokenService(라이프사이클)는 Optional/Result 로만 답하고,
 * 여기서 그 결과를 HTTP 에러 코드(ApiException)로 바꾼다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthTokenService {

    private final JwtService jwtService;
    private final RefreshTokenService refreshTokenService;
    private final UserDirectory userDirectory;
    private final RevocationCache revocationCache;
    private final SecurityAudit audit;
    private final Clock clock;

    /**
     * 재발급(rotation)
     *
     * 1) 만료된 Access Token 에서 클레임 복원 (서명/알고리즘은 검증, 만료만 무시)
     * 2) Refresh Token 이 그 jti / userId 와 짝인지 + Active 인지 검증
     * 3) 유저가 아직 ACTIVE 인지
     * 4) 새 Access Token 발급 -> 새 jti 로 Refresh Token 회전
     *
     * 어느 단계에서 실패하든 REFRESH_INVALID 하나로 응답 (실패 이유 노출 안 함)
     */
    public TokenResponse refresh(String accessToken, String refreshToken, String ip, String deviceInfo) {
        AccessTokenClaims claims = jwtService.parseExpired(accessToken).orElse(null);
        if (claims == null || claims.userId() == null || claims.jwtId() == null) {
            log.warn("Refresh rejected from IP {}: access token unreadable", ip);
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        String userId = String.valueOf(claims.userId());

        RefreshToken current = refreshTokenService
                .validate(refreshToken, claims.jwtId(), claims.userId())
                .orElse(null);
        if (current == null) {
            audit.record(sink -> sink.authFailure(userId, ip, "Invalid refresh token"));
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        User user = userDirectory.findById(claims.userId()).orElse(null);
        if (user == null || !user.isActive()) {
            audit.record(sink -> sink.authFailure(userId, ip, "User missing or inactive"));
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        IssuedAccessToken access = jwtService.issue(
                AccessTokenSubject.of(user, userDirectory.getRoles(user)));

        RefreshToken next = refreshTokenService
                .rotate(current, access.jwtId(), ip, deviceInfo)
                .orElse(null);
        if (next == null) {
            // 동시 재발급 경쟁에서 졌거나 저장 실패. 방금 만든 Access Token 은 버린다. (짝 Refresh 가 없음)
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        audit.record(sink -> sink.tokenRefresh(userId, ip));
        return TokenResponse.of(access, next);
    }

    /**
     * Refresh Token 단건 폐기
     * - 없는 토큰이면 REVOKE_FAILED (Result 메시지 그대로)
     * - 이미 폐기된 토큰은 성공 (멱등)
     */
    public void revoke(String refreshToken, String ip, String reason) {
        Result result = refreshTokenService.revoke(refreshToken, ip, reason);
        if (result.isFailure()) {
            throw new ApiException(ErrorCode.REVOKE_FAILED, result.error());
        }
    }

    /**
     * 로그아웃: 유저의 모든 세션 종료
     *
     * - Active Refresh Token 전부 LOGOUT 으로 폐기 (짝 Access Token jti 는 커밋 후 리스너가 캐시에 올림)
     * - 지금 요청에 쓰인 Access Token 도 남은 수명만큼 폐기 캐시에 올린다.
     *   (회전으로 이미 짝을 잃은 Access Token 일 수 있으므로 따로 처리)
     */
    public void logout(AuthPrincipal principal, String ip) {
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }

        Result result = refreshTokenService.revokeAllForUser(
                principal.userId(), ip, RefreshRevokeReason.LOGOUT.name());
        if (result.isFailure()) {
            log.error("Logout failed for user {}: {}", principal.userId(), result.error());
            throw new ApiException(ErrorCode.LOGOUT_FAILED);
        }

        revocationCache.revoke(principal.jwtId(), remainingLifetime(principal));

        String userId = String.valueOf(principal.userId());
        audit.record(sink -> sink.logout(userId, ip));
    }

    private Duration remainingLifetime(AuthPrincipal principal) {
        if (principal.expiresAt() == null)
            return Duration.ofSeconds(jwtService.accessTtlSeconds());
        return Duration.between(clock.instant(), principal.expiresAt());
    }
}
