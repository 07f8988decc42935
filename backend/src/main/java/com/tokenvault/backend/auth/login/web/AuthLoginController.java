package com.tokenvault.backend.auth.login.web;

import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tokenvault.backend.auth.login.dto.LoginRequest;
import com.tokenvault.backend.auth.login.service.LoginService;
import com.tokenvault.backend.auth.support.ClientInfoResolver;
import com.tokenvault.backend.auth.token.dto.TokenResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API 컨트롤러 (web 계층, 얇게 유지)
 * 1) JSON -> DTO (@RequestBody) + 1차 검증 (@Valid)
 * 2) 요청자 IP / User-Agent 추출
 * 3) 실제 로직은 LoginService 로 위임
 * 토큰이 담긴 응답이라 Cache-Control: no-store
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLoginController {

    private final LoginService loginService;
    private final ClientInfoResolver clientInfo;

    /**
     * POST /auth/login
     *
     * Request: { "username": "alice", "password": "password123!" }
     * Response: { "accessToken": "...", "refreshToken": "...", "tokenType": "Bearer", ... }
     */
    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest req, HttpServletRequest request) {
        TokenResponse tokens = loginService.login(
                req.username(),
                req.password(),
                clientInfo.clientIp(request),
                clientInfo.deviceInfo(request));
        return ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(tokens);
    }
}
