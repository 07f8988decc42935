package com.tokenvault.backend.auth.token.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RevokeRequest(
        @NotBlank(message = "refreshToken is required")
        @Size(max = 128, message = "refreshToken is too long")
        String refreshToken,
        @Size(max = 100, message = "reason is too long")
        String reason
) {}
