package com.tokenvault.backend.auth.audit;

/**
 * 보안 감사 이벤트 수신자 (외부 계약)
 *
 * - 식별자는 전부 문자열 (userId, username 등 호출자가 가진 값을 그대로)
 * - 토큰 원문을 받더라도 구현체는 원문 전체를 남기면 안 된다.
 * - 구현체가 예외를 던져도 호출자는 SecurityAudit 을 통해서만 부르므로 인증 흐름은 깨지지 않는다.
 */
public interface SecurityAuditSink {

    void authSuccess(String userId, String ip);

    void authFailure(String userIdentifier, String ip, String reason);

    void tokenRefresh(String userId, String ip);

    void tokenRevocation(String token, String ip, String reason);

    void logout(String userId, String ip);

    void registration(String userId, String ip);

    /** 동시 세션 제한으로 밀려난 세션 */
    void sessionEvicted(String userId, String token, String ip);

    void securityViolation(String userId, String violation, String ip);
}
