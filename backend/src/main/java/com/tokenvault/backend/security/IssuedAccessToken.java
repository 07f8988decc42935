package com.tokenvault.backend.security;

import java.time.Instant;

/**
 * 발급 결과: compact 토큰 + jti + 절대 만료 시각
 * - jti는 같이 발급되는 Refresh Token과 짝을 맺는 키이자 폐기 캐시의 키
 */
public record IssuedAccessToken(String token, String jwtId, Instant expiresAt) {}
