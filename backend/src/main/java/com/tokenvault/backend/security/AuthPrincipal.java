package com.tokenvault.backend.security;

import java.time.Instant;
import java.util.Set;

/**
 * 인증 완료 후 SecurityContext에 올릴 "로그인 사용자 정보" 모델
 *
 * JwtAuthenticationFilter에서 JWT 검증 + 폐기 캐시 확인을 통과하면 이 AuthPrincipal을 만들어 Authentication에 넣는다.
 * - jwtId / expiresAt: 로그아웃 시 현재 Access Token을 남은 수명만큼 폐기 캐시에 올리기 위해 들고 다닌다.
 */
public record AuthPrincipal(
        Long userId,
        String username,
        Set<String> roles,
        String jwtId,
        Instant expiresAt
) {}
