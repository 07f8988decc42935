package com.tokenvault.backend.auth.me.dto;

import java.time.LocalDateTime;
import java.util.Set;

public record MeResponse(
        Long userId,
        String username,
        String email,
        String firstName,
        String lastName,
        Set<String> roles,
        LocalDateTime lastLoginAt
) {}
