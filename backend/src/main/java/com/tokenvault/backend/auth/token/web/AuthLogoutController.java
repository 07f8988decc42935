package com.tokenvault.backend.auth.token.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.tokenvault.backend.auth.support.ClientInfoResolver;
import com.tokenvault.backend.auth.token.service.AuthTokenService;
import com.tokenvault.backend.security.AuthPrincipal;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * 로그아웃 (인증 필요)
 * - 유저의 모든 Refresh Token 폐기 + 지금 쓰고 있는 Access Token 도 폐기 캐시에 올림
 * - 이후 같은 Access Token 으로 오는 요청은 필터에서 401 ACCESS_REVOKED
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLogoutController {

    private final AuthTokenService authTokenService;
    private final ClientInfoResolver clientInfo;

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@AuthenticationPrincipal AuthPrincipal principal, HttpServletRequest request) {
        authTokenService.logout(principal, clientInfo.clientIp(request));
    }
}
