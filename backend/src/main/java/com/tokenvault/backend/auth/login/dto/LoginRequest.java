package com.tokenvault.backend.auth.login.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "username is required")
        @Size(max = 50, message = "username is too long")
        String username,
        @NotBlank(message = "password is required")
        @Size(max = 72, message = "password is too long")
        String password
) {}
