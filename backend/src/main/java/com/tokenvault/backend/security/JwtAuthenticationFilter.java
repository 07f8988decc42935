package com.tokenvault.backend.security;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.tokenvault.backend.auth.revocation.RevocationCache;
import com.tokenvault.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Access Token 인증 필터 (컨트롤러 이전)
 *
 * 1) Authorization: Bearer 헤더가 없으면 통과 (막는 건 authorize 규칙 + RestAuthEntryPoint)
 * 2) 서명 / 알고리즘 / 만료 / iss / aud 검증 실패 -> 401 ACCESS_INVALID
 * 3) 폐기 캐시에 jti 가 있으면 -> 401 ACCESS_REVOKED (로그아웃, 세션 밀림, 재사용 탐지로 끊긴 세션)
 * 4) 통과하면 AuthPrincipal 을 SecurityContext 에 올린다.
 *
 * 공개 토큰 엔드포인트(signup / login / refresh)는 거르지 않는다.
 * 재발급은 만료된 Access Token 을 들고 오는 요청이라 헤더가 남아 있어도 여기서 401 을 내면 안 된다.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String ROLE_PREFIX = "ROLE_";

    static final Set<String> PUBLIC_POST_PATHS = Set.of("/auth/signup", "/auth/login", "/auth/refresh");

    private final JwtService jwtService;
    private final RevocationCache revocationCache;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!HttpMethod.POST.matches(request.getMethod()))
            return false;
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return PUBLIC_POST_PATHS.contains(path);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String token = bearerToken(request);
        if (token == null || SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        AuthPrincipal principal;
        try {
            principal = jwtService.verifyAccessToken(token);
        } catch (JwtService.InvalidJwtException ex) {
            reject(response, ErrorCode.ACCESS_INVALID);
            return;
        }

        if (revocationCache.isRevoked(principal.jwtId())) {
            log.warn("Blocked request with revoked access token {} for user {}", principal.jwtId(), principal.userId());
            reject(response, ErrorCode.ACCESS_REVOKED);
            return;
        }

        SecurityContextHolder.getContext().setAuthentication(toAuthentication(principal, request));
        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        SecurityContextHolder.clearContext();
        errorWriter.write(response, errorCode);
    }

    private static UsernamePasswordAuthenticationToken toAuthentication(AuthPrincipal principal,
                                                                         HttpServletRequest request) {
        List<SimpleGrantedAuthority> authorities = principal.roles().stream()
                .map(role -> role.startsWith(ROLE_PREFIX) ? role : ROLE_PREFIX + role)
                .map(SimpleGrantedAuthority::new)
                .toList();

        var authentication = new UsernamePasswordAuthenticationToken(principal, null, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        return authentication;
    }

    // "Bearer <token>" 이 아니면 null
    static String bearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length()))
            return null;

        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
