package com.tokenvault.backend.auth.signup.dto;

public record SignupResponse(Long userId, String username, String email) {}
