package com.tokenvault.backend.auth.signup.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 회원가입 요청 DTO
 * - 형식 검증만 담당. 중복/비밀번호 확인 일치는 SignupService 에서
 * - 비밀번호 최대 72자: BCrypt 가 72바이트 이후를 무시하기 때문
 */
public record SignupRequest(
        @NotBlank(message = "username is required")
        @Size(min = 3, max = 50, message = "username must be 3-50 characters")
        @Pattern(regexp = "^[A-Za-z0-9._-]+$", message = "username contains invalid characters")
        String username,
        @NotBlank(message = "email is required")
        @Email(message = "email is malformed")
        @Size(max = 255, message = "email is too long")
        String email,
        @NotBlank(message = "password is required")
        @Size(min = 8, max = 72, message = "password must be 8-72 characters")
        String password,
        @NotBlank(message = "passwordConfirm is required")
        @Size(max = 72, message = "passwordConfirm is too long")
        String passwordConfirm,
        @Size(max = 100, message = "firstName is too long")
        String firstName,
        @Size(max = 100, message = "lastName is too long")
        String lastName
) {}
