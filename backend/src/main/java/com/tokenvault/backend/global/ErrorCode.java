package com.tokenvault.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 중앙화된 에러 코드 (HTTP 상태 + 기본 메시지)
 *
 * - NotFound / InvalidState 계열은 호출자에게 구분해서 알려주지 않는다. (계정/토큰 열거 방지)
 *   -> INVALID_CREDENTIALS, REFRESH_INVALID 로 뭉갠다.
 */
public enum ErrorCode {

    // 400
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Request validation failed"),
    PASSWORD_MISMATCH(HttpStatus.BAD_REQUEST, "Passwords do not match"),
    PASSWORD_POLICY_VIOLATION(HttpStatus.BAD_REQUEST, "Password does not meet the password policy"),
    REVOKE_FAILED(HttpStatus.BAD_REQUEST, "Token revocation failed"),

    // 401
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED, "Authentication is required"),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED, "Invalid access token"),
    ACCESS_REVOKED(HttpStatus.UNAUTHORIZED, "Token has been revoked"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid username or password"),
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED, "Invalid refresh token"),

    // 403
    ACCOUNT_DISABLED(HttpStatus.FORBIDDEN, "Account is deactivated"),

    // 423
    ACCOUNT_LOCKED(HttpStatus.LOCKED, "Account is temporarily locked due to multiple failed attempts"),

    // 409
    USERNAME_TAKEN(HttpStatus.CONFLICT, "Username is already taken"),
    EMAIL_TAKEN(HttpStatus.CONFLICT, "Email is already registered"),

    // 500
    AUTH_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "An error occurred during authentication"),
    LOGOUT_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "An error occurred during logout"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
