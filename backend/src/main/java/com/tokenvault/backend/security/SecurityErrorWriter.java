package com.tokenvault.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenvault.backend.global.ApiError;
import com.tokenvault.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 필터 단계(컨트롤러 밖)의 401 응답 작성기
 *
 * - 본문은 GlobalExceptionHandler 와 같은 ApiError JSON
 * - 401 에는 Bearer 챌린지(WWW-Authenticate, RFC 6750)를 붙인다.
 *   토큰이 아예 없으면 realm 만, 토큰이 있었는데 거절이면 error="invalid_token"
 * - 토큰 관련 응답은 캐시 금지
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {

    static final String REALM = "tokenvault";

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        write(response, errorCode, errorCode.defaultMessage());
    }

    public void write(HttpServletResponse response, ErrorCode errorCode, String message) throws IOException {
        if (response.isCommitted())
            return;

        response.setStatus(errorCode.status().value());
        if (errorCode.status() == HttpStatus.UNAUTHORIZED)
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, challenge(errorCode, message));
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);

        objectMapper.writeValue(response.getWriter(), ApiError.of(errorCode, message));
    }

    static String challenge(ErrorCode errorCode, String message) {
        if (errorCode == ErrorCode.AUTH_REQUIRED)
            return "Bearer realm=\"" + REALM + "\"";
        return "Bearer realm=\"" + REALM + "\", error=\"invalid_token\", error_description=\""
                + message.replace("\"", "'") + "\"";
    }
}
