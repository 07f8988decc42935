package com.tokenvault.backend.auth.me.web;

import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tokenvault.backend.auth.me.dto.MeResponse;
import com.tokenvault.backend.auth.me.service.MeService;
import com.tokenvault.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * GET /auth/me (인증 필요)
 * - 폐기 캐시까지 통과한 Access Token 의 주인 정보. 계정 정보라 캐시 금지
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthMeController {

    private final MeService meService;

    @GetMapping("/me")
    public ResponseEntity<MeResponse> me(@AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(meService.me(principal));
    }
}
