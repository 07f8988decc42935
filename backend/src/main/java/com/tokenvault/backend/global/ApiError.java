package com.tokenvault.backend.global;

/**
 * 에러 응답 본문: {"code": "REFRESH_INVALID", "message": "Invalid refresh token"}
 * - 필터(SecurityErrorWriter)와 GlobalExceptionHandler 가 같은 포맷을 쓴다.
 */
public record ApiError(String code, String message) {

    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage());
    }

    public static ApiError of(ErrorCode errorCode, String message) {
        return new ApiError(errorCode.name(), message == null ? errorCode.defaultMessage() : message);
    }
}
