package com.tokenvault.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 유스케이스 계층(로그인 / 가입 / 재발급 / 로그아웃)이 던지는 예외
 * - ErrorCode 하나가 HTTP 상태와 응답 코드를 같이 결정한다.
 * - 메시지를 덮어쓰면 그 메시지가 응답에 그대로 나간다. (예: 폐기 실패 사유)
 *
 * 라이프사이클 서비스(RefreshTokenService)는 이 예외를 던지지 않는다. (Optional / Result 반환)
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage());
    }

    public ApiException(ErrorCode errorCode, String message) {
        super(message == null ? errorCode.defaultMessage() : message);
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return errorCode.status();
    }

    public String getCode() {
        return errorCode.name();
    }

    public ApiError toApiError() {
        return ApiError.of(errorCode, getMessage());
    }
}
