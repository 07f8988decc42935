package com.tokenvault.backend.auth.audit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import com.tokenvault.backend.support.TestAuthProperties;

@ExtendWith(OutputCaptureExtension.class)
@DisplayName("[Audit] SECURITY_AUDIT 로그 / 토글 / 토큰 마스킹")
class LoggingSecurityAuditSinkTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static final String TOKEN = "AbCdEfGh-this-part-must-never-be-logged";

    private static LoggingSecurityAuditSink sink(boolean enabled, boolean success, boolean failure,
                                                 boolean tokens, boolean users) {
        return new LoggingSecurityAuditSink(
                TestAuthProperties.withAudit(TestAuthProperties.audit(enabled, success, failure, tokens, users)),
                CLOCK);
    }

    @Test
    @DisplayName("토큰은 앞 8자리 + ... 만 남긴다")
    void mask_keeps_prefix_only() {
        assertThat(LoggingSecurityAuditSink.mask(TOKEN)).isEqualTo("AbCdEfGh...");
        assertThat(LoggingSecurityAuditSink.mask("short")).isEqualTo("short");
        assertThat(LoggingSecurityAuditSink.mask(null)).isNull();
    }

    @Test
    @DisplayName("모든 토글 on: 각 이벤트가 한 줄씩, 시각 / IP 포함, 원본 토큰 없음")
    void all_events_logged(CapturedOutput output) {
        SecurityAuditSink sink = sink(true, true, true, true, true);

        sink.authSuccess("7", "203.0.113.10");
        sink.authFailure("mallory", null, "Invalid credentials");
        sink.tokenRefresh("7", "203.0.113.10");
        sink.tokenRevocation(TOKEN, "203.0.113.10", null);
        sink.logout("7", "203.0.113.10");
        sink.registration("8", "203.0.113.11");
        sink.sessionEvicted("7", TOKEN, "203.0.113.10");
        sink.securityViolation("7", "Refresh token reuse detected", "198.51.100.9");

        assertThat(output.getOut())
                .contains("SECURITY_AUDIT: Successful authentication for user 7 from IP 203.0.113.10 at " + NOW)
                .contains("SECURITY_AUDIT: Failed authentication attempt for user mallory from IP unknown")
                .contains("Reason: Invalid credentials")
                .contains("SECURITY_AUDIT: Token refresh for user 7")
                .contains("SECURITY_AUDIT: Token revocation for token AbCdEfGh...")
                .contains("Reason: not specified")
                .contains("SECURITY_AUDIT: User logout for user 7")
                .contains("SECURITY_AUDIT: User registration for user 8")
                .contains("SECURITY_AUDIT: Session evicted for user 7 (token AbCdEfGh...)")
                .contains("Violation: Refresh token reuse detected")
                .doesNotContain(TOKEN);
    }

    @Test
    @DisplayName("enabled=false: 보안 위반까지 전부 침묵")
    void disabled_sink_is_silent(CapturedOutput output) {
        SecurityAuditSink sink = sink(false, true, true, true, true);

        sink.authSuccess("7", "ip");
        sink.securityViolation("7", "Refresh token reuse detected", "ip");

        assertThat(output.getOut()).doesNotContain("SECURITY_AUDIT");
    }

    @Test
    @DisplayName("세부 토글: 꺼진 분류만 빠지고, 보안 위반은 enabled 만 따른다")
    void category_toggles(CapturedOutput output) {
        SecurityAuditSink sink = sink(true, false, true, false, false);

        sink.authSuccess("7", "ip");
        sink.tokenRefresh("7", "ip");
        sink.logout("7", "ip");
        sink.authFailure("7", "ip", "Bad password");
        sink.securityViolation("7", "Refresh token reuse detected", "ip");

        assertThat(output.getOut())
                .doesNotContain("Successful authentication")
                .doesNotContain("Token refresh")
                .doesNotContain("User logout")
                .contains("Failed authentication attempt for user 7")
                .contains("Security violation by user 7");
    }

    @Test
    @DisplayName("SecurityAudit: sink 하나가 터져도 다음 sink 는 계속 받고 호출자는 예외를 못 본다")
    void failing_sink_does_not_break_fan_out(CapturedOutput output) {
        SecurityAuditSink broken = new SecurityAuditSink() {
            @Override public void authSuccess(String userId, String ip) { throw new IllegalStateException("boom"); }
            @Override public void authFailure(String userIdentifier, String ip, String reason) {}
            @Override public void tokenRefresh(String userId, String ip) {}
            @Override public void tokenRevocation(String token, String ip, String reason) {}
            @Override public void logout(String userId, String ip) {}
            @Override public void registration(String userId, String ip) {}
            @Override public void sessionEvicted(String userId, String token, String ip) {}
            @Override public void securityViolation(String userId, String violation, String ip) {}
        };
        SecurityAudit audit = new SecurityAudit(List.of(broken, sink(true, true, true, true, true)));

        audit.record(s -> s.authSuccess("7", "203.0.113.10"));

        assertThat(output.getOut())
                .contains("Security audit sink")
                .contains("SECURITY_AUDIT: Successful authentication for user 7");
    }
}
