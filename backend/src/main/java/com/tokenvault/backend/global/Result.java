package com.tokenvault.backend.global;

/**
 * 성공/실패 결과 객체
 *
 * - 예상 가능한 비즈니스 결과(토큰 없음, 이미 폐기됨 등)는 예외 대신 Result로 돌려준다.
 * - error에는 호출자에게 그대로 보여줘도 되는 메시지만 담는다. (내부 예외 메시지 금지)
 */
public record Result(boolean success, String error) {

    private static final Result SUCCESS = new Result(true, "");

    public static Result ok() {
        return SUCCESS;
    }

    public static Result failure(String error) {
        return new Result(false, error);
    }

    public boolean isFailure() {
        return !success;
    }
}
