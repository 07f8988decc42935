package com.tokenvault.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.tokenvault.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bearer 토큰 없이 보호 엔드포인트(/auth/me, /auth/logout, /auth/revoke ...)에 들어온 경우 -> 401 AUTH_REQUIRED
 * 토큰이 있었는데 거절된 경우는 JwtAuthenticationFilter 가 먼저 응답한다.
 */
@Slf4j
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        log.debug("Unauthenticated {} {}", request.getMethod(), request.getRequestURI());
        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}
