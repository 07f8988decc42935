package com.tokenvault.backend.auth.audit;

import java.time.Clock;
import java.time.Instant;

import org.springframework.stereotype.Component;

import com.tokenvault.backend.auth.config.AuthProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * 기본 감사 구현: "SECURITY_AUDIT:" 접두사를 붙인 로그 한 줄
 *
 * app.auth.audit.* 토글
 * - enabled=false 면 전부 끔
 * - logSuccessfulAuthentication / logFailedAuthentication: 로그인 성공/실패
 * - logTokenOperations: 재발급 / 폐기 / 세션 밀림
 * - logUserOperations: 가입 / 로그아웃
 * - 보안 위반(securityViolation)은 enabled 만 본다.
 */
@Slf4j
@Component
public class LoggingSecurityAuditSink implements SecurityAuditSink {

    private static final String UNKNOWN = "unknown";
    private static final int TOKEN_PREFIX_LENGTH = 8;

    private final AuthProperties.Audit audit;
    private final Clock clock;

    public LoggingSecurityAuditSink(AuthProperties props, Clock clock) {
        this.audit = props.audit();
        this.clock = clock;
    }

    @Override
    public void authSuccess(String userId, String ip) {
        if (!audit.enabled() || !audit.logSuccessfulAuthentication())
            return;
        log.info("SECURITY_AUDIT: Successful authentication for user {} from IP {} at {}",
                userId, orUnknown(ip), now());
    }

    @Override
    public void authFailure(String userIdentifier, String ip, String reason) {
        if (!audit.enabled() || !audit.logFailedAuthentication())
            return;
        log.warn("SECURITY_AUDIT: Failed authentication attempt for user {} from IP {} at {}. Reason: {}",
                userIdentifier, orUnknown(ip), now(), reason);
    }

    @Override
    public void tokenRefresh(String userId, String ip) {
        if (!audit.enabled() || !audit.logTokenOperations())
            return;
        log.info("SECURITY_AUDIT: Token refresh for user {} from IP {} at {}",
                userId, orUnknown(ip), now());
    }

    @Override
    public void tokenRevocation(String token, String ip, String reason) {
        if (!audit.enabled() || !audit.logTokenOperations())
            return;
        log.info("SECURITY_AUDIT: Token revocation for token {} from IP {} at {}. Reason: {}",
                mask(token), orUnknown(ip), now(), reason == null ? "not specified" : reason);
    }

    @Override
    public void logout(String userId, String ip) {
        if (!audit.enabled() || !audit.logUserOperations())
            return;
        log.info("SECURITY_AUDIT: User logout for user {} from IP {} at {}",
                userId, orUnknown(ip), now());
    }

    @Override
    public void registration(String userId, String ip) {
        if (!audit.enabled() || !audit.logUserOperations())
            return;
        log.info("SECURITY_AUDIT: User registration for user {} from IP {} at {}",
                userId, orUnknown(ip), now());
    }

    @Override
    public void sessionEvicted(String userId, String token, String ip) {
        if (!audit.enabled() || !audit.logTokenOperations())
            return;
        log.info("SECURITY_AUDIT: Session evicted for user {} (token {}) from IP {} at {}. Reason: session limit exceeded",
                userId, mask(token), orUnknown(ip), now());
    }

    @Override
    public void securityViolation(String userId, String violation, String ip) {
        if (!audit.enabled())
            return;
        log.warn("SECURITY_AUDIT: Security violation by user {} from IP {} at {}. Violation: {}",
                userId, orUnknown(ip), now(), violation);
    }

    /**
     * 토큰은 앞 8자리 + "..." 만 남긴다.
     */
    static String mask(String token) {
        if (token == null)
            return null;
        return token.length() > TOKEN_PREFIX_LENGTH
                ? token.substring(0, TOKEN_PREFIX_LENGTH) + "..."
                : token;
    }

    private static String orUnknown(String ip) {
        return ip == null || ip.isBlank() ? UNKNOWN : ip;
    }

    private Instant now() {
        return clock.instant();
    }
}
