package com.tokenvault.backend.security;

import java.util.Set;

import com.tokenvault.backend.auth.user.User;

/**
 * Access Token에 실을 "누구의 토큰인지" 정보 (JwtService.issue 입력)
 */
public record AccessTokenSubject(
        Long userId,
        String username,
        String email,
        Set<String> roles,
        String clientId
) {
    public AccessTokenSubject {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public static AccessTokenSubject of(User user, Set<String> roles) {
        return new AccessTokenSubject(user.getId(), user.getUsername(), user.getEmail(), roles, user.getClientId());
    }
}
