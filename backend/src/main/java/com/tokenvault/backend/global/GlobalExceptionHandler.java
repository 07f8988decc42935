package com.tokenvault.backend.global;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;

import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - 컨트롤러/서비스에서 발생한 예외를 가로채
 * - HTTP 상태 코드 + ApiError 포맷으로 통일된 응답을 반환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handle(ApiException e) {
        return ResponseEntity
                .status(e.getStatus())
                .body(e.toApiError());
    }

    /**
     * @RequestBody + @Valid 검증 실패
     * - 어떤 필드가 왜 실패했는지는 로그에만 남긴다.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handle(MethodArgumentNotValidException e) {
        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("Validation error: field={}, message={}",
                        fe.getField(),
                        fe.getDefaultMessage()));

        return validationError();
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handle(ConstraintViolationException e) {
        return validationError();
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handle(HttpMessageNotReadableException e) {
        return validationError();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handle(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity
                .status(INTERNAL_SERVER_ERROR)
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }

    private static ResponseEntity<ApiError> validationError() {
        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }
}
