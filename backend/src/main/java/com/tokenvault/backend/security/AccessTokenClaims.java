package com.tokenvault.backend.security;

import java.time.Instant;
import java.util.Set;

/**
 * 서명 검증을 통과한 Access Token에서 복원한 클레임
 * - parseExpired()는 만료를 무시하므로 expiresAt이 과거일 수 있다.
 */
public record AccessTokenClaims(
        String jwtId,
        Long userId,
        String username,
        String email,
        Set<String> roles,
        String clientId,
        Instant issuedAt,
        Instant expiresAt
) {}
