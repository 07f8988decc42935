package com.tokenvault.backend.auth.token.service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Refresh Token이 (회전 이외의 이유로) 폐기됐다는 도메인 이벤트
 *
 * - 커밋 이후 RevokedRefreshTokenListener 가 짝 Access Token의 jti를 폐기 캐시에 넣는다.
 * - issuedAt: 짝 Access Token 발급 시각 (= refresh createdAt). 남은 수명 계산용
 */
public record RefreshTokensRevokedEvent(
        Long userId,
        List<PairedAccessToken> accessTokens,
        String reason
) {

    public RefreshTokensRevokedEvent {
        accessTokens = List.copyOf(accessTokens);
    }

    public record PairedAccessToken(String jwtId, LocalDateTime issuedAt) {}
}
