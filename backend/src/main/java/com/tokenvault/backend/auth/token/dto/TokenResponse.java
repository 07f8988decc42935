package com.tokenvault.backend.auth.token.dto;

import java.time.Instant;
import java.time.ZoneOffset;

import com.tokenvault.backend.auth.token.domain.RefreshToken;
import com.tokenvault.backend.security.IssuedAccessToken;

/**
 * 로그인 / 재발급 응답 DTO
 *
 * - accessToken: 매 요청 Authorization: Bearer ... 로 사용 (짧은 TTL)
 * - refreshToken: /auth/refresh 에 다시 보내는 불투명 토큰 (긴 TTL, 서버 DB에서 통제)
 * - 두 토큰은 jti 로 짝지어져 있어서 재발급 요청에는 둘 다 필요하다.
 */
public record TokenResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        Instant accessTokenExpiresAt,
        Instant refreshTokenExpiresAt
) {

    private static final String BEARER = "Bearer";

    public static TokenResponse of(IssuedAccessToken access, RefreshToken refresh) {
        return new TokenResponse(
                access.token(),
                refresh.getToken(),
                BEARER,
                access.expiresAt(),
                refresh.getExpiresAt().toInstant(ZoneOffset.UTC));
    }
}
