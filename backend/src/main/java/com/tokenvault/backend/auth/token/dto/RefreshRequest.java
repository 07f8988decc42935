package com.tokenvault.backend.auth.token.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 재발급 요청: 만료된(또는 만료 직전) Access Token + 짝 Refresh Token
 */
public record RefreshRequest(
        @NotBlank(message = "accessToken is required")
        String accessToken,
        @NotBlank(message = "refreshToken is required")
        @Size(max = 128, message = "refreshToken is too long")
        String refreshToken
) {}
