package com.tokenvault.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;


/**
 * @ConfigurationProperties(prefix = "app.auth"):
 * application.yml 의 app.auth.* 값을 타입 안정성 있게 바인딩해준다.
 *
 * - 검증 실패(서명키 누락, 음수 TTL 등)는 기동 시점에 바로 실패한다. 런타임에 복구하지 않는다.
 * - 시간 값은 전부 "초" 단위
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @Valid @NotNull Jwt jwt,
        @Valid @DefaultValue Refresh refresh,
        @Valid @DefaultValue Sweep sweep,
        @Valid @DefaultValue Revocation revocation,
        @Valid @DefaultValue Lockout lockout,
        @Valid @DefaultValue PasswordPolicy passwordPolicy,
        @Valid @DefaultValue Audit audit
) {

    /**
     * Access Token(JWT) 관련 설정 (referenced by JwtService)
     * - issuer / audience: 발급자, 대상 (검증 시 강제)
     * - secret: HS256 서명을 위한 비밀키 문자열 (32바이트 이상)
     * - accessTtlSeconds: Access Token 수명 (기본 15분)
     */
    public record Jwt(
            @NotBlank String issuer,
            @NotBlank String audience,
            @NotBlank @Size(min = 32) String secret,
            @DefaultValue("900") @Min(1) long accessTtlSeconds
    ) {}

    /**
     * Refresh Token 정책 (referenced by RefreshTokenService)
     * - ttlSeconds: 서버 측 세션 TTL (기본 7일)
     * - maxConcurrentSessions: 유저당 동시 활성 세션 수. 0 이하이면 제한 없음
     * - tokenBytes: 토큰 원문 엔트로피 (Base64URL 인코딩 전 바이트 수)
     * - reuseDetection: 회전된 토큰 재제출 시 후손 체인까지 폐기할지
     */
    public record Refresh(
            @DefaultValue("604800") @Min(1) long ttlSeconds,
            @DefaultValue("5") int maxConcurrentSessions,
            @DefaultValue("64") @Min(32) int tokenBytes,
            @DefaultValue("true") boolean reuseDetection
    ) {}

    /**
     * 만료 토큰 청소 작업 (referenced by RefreshTokenSweeper)
     */
    public record Sweep(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("60") @Min(0) long initialDelaySeconds,
            @DefaultValue("21600") @Min(1) long intervalSeconds,
            @DefaultValue("1800") @Min(1) long errorBackoffSeconds,
            @DefaultValue("86400") @Min(0) long expiredGraceSeconds,
            @DefaultValue("2592000") @Min(0) long revokedRetentionSeconds
    ) {}

    /**
     * Access Token 폐기 캐시 (referenced by RevocationCache, RevocationCacheJanitor)
     */
    public record Revocation(
            @DefaultValue("86400") @Min(1) long defaultTtlSeconds,
            @DefaultValue("300") @Min(1) long cleanupIntervalSeconds,
            @DefaultValue("true") boolean warmUpOnStartup
    ) {}

    /**
     * 로그인 실패 잠금 (referenced by LoginService)
     * - maxFailedAttempts 번 연속 비밀번호가 틀리면 durationSeconds 동안 잠근다. (기본 5회 / 15분)
     */
    public record Lockout(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("5") @Min(1) int maxFailedAttempts,
            @DefaultValue("900") @Min(1) long durationSeconds
    ) {}

    /**
     * 가입 시 비밀번호 규칙 (referenced by PasswordPolicyValidator)
     * - 길이 상한(72)은 BCrypt 입력 한계라서 DTO 검증에 고정
     */
    public record PasswordPolicy(
            @DefaultValue("8") @Min(1) int minLength,
            @DefaultValue("true") boolean requireUppercase,
            @DefaultValue("true") boolean requireLowercase,
            @DefaultValue("true") boolean requireDigit,
            @DefaultValue("true") boolean requireSpecial,
            @DefaultValue("2") @Min(1) int maxRepeatedChars
    ) {}

    /**
     * 보안 감사 로그 토글 (referenced by LoggingSecurityAuditSink)
     */
    public record Audit(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("true") boolean logSuccessfulAuthentication,
            @DefaultValue("true") boolean logFailedAuthentication,
            @DefaultValue("true") boolean logTokenOperations,
            @DefaultValue("true") boolean logUserOperations
    ) {}
}
