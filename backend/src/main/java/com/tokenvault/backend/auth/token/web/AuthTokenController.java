package com.tokenvault.backend.auth.token.web;

import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.tokenvault.backend.auth.support.ClientInfoResolver;
import com.tokenvault.backend.auth.token.dto.RefreshRequest;
import com.tokenvault.backend.auth.token.dto.RevokeRequest;
import com.tokenvault.backend.auth.token.dto.TokenResponse;
import com.tokenvault.backend.auth.token.service.AuthTokenService;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthTokenController {

    private final AuthTokenService authTokenService;
    private final ClientInfoResolver clientInfo;

    /**
     * POST /auth/refresh (공개)
     * - 만료된 Access Token + 짝 Refresh Token -> 새 토큰 쌍 (기존 Refresh 는 ROTATED)
     */
    @PostMapping("/refresh")
    public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody RefreshRequest req, HttpServletRequest request) {
        TokenResponse tokens = authTokenService.refresh(
                req.accessToken(),
                req.refreshToken(),
                clientInfo.clientIp(request),
                clientInfo.deviceInfo(request));
        return ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(tokens);
    }

    /**
     * POST /auth/revoke (인증 필요) -> 204
     */
    @PostMapping("/revoke")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revoke(@Valid @RequestBody RevokeRequest req, HttpServletRequest request) {
        authTokenService.revoke(req.refreshToken(), clientInfo.clientIp(request), req.reason());
    }
}
