package com.tokenvault.backend.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.tokenvault.backend.auth.config.AuthProperties;
import com.tokenvault.backend.support.MutableClock;
import com.tokenvault.backend.support.TestAuthProperties;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

@DisplayName("[Security] JwtService 발급/검증")
class JwtServiceTest {

    private MutableClock clock;
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        jwtService = new JwtService(TestAuthProperties.defaults(), clock);
    }

    private AccessTokenSubject subject() {
        return new AccessTokenSubject(42L, "alice", "alice@example.com", Set.of("USER", "ADMIN"), "client-1");
    }

    @Test
    @DisplayName("발급한 토큰은 검증을 통과하고 userId / roles / jti 가 복원된다")
    void issued_token_verifies() {
        IssuedAccessToken issued = jwtService.issue(subject());

        AuthPrincipal principal = jwtService.verifyAccessToken(issued.token());

        assertThat(principal.userId()).isEqualTo(42L);
        assertThat(principal.username()).isEqualTo("alice");
        assertThat(principal.roles()).containsExactlyInAnyOrder("USER", "ADMIN");
        assertThat(principal.jwtId()).isEqualTo(issued.jwtId());
        assertThat(issued.expiresAt()).isEqualTo(MutableClock.START.plusSeconds(900));
    }

    @Test
    @DisplayName("발급할 때마다 jti 가 다르다")
    void each_issue_has_fresh_jti() {
        assertThat(jwtService.issue(subject()).jwtId())
                .isNotEqualTo(jwtService.issue(subject()).jwtId());
    }

    @Test
    @DisplayName("만료된 토큰: verify 는 실패, parseExpired 는 클레임을 돌려준다")
    void expired_token_is_parseable_for_refresh() {
        IssuedAccessToken issued = jwtService.issue(subject());
        clock.advance(Duration.ofMinutes(16));

        assertThatThrownBy(() -> jwtService.verifyAccessToken(issued.token()))
                .isInstanceOf(JwtService.InvalidJwtException.class);

        Optional<AccessTokenClaims> claims = jwtService.parseExpired(issued.token());
        assertThat(claims).isPresent();
        assertThat(claims.get().jwtId()).isEqualTo(issued.jwtId());
        assertThat(claims.get().userId()).isEqualTo(42L);
        assertThat(claims.get().email()).isEqualTo("alice@example.com");
        assertThat(claims.get().clientId()).isEqualTo("client-1");
    }

    @Test
    @DisplayName("다른 키로 서명된 토큰은 parseExpired 에서도 거절 (예외 없이 empty)")
    void foreign_signature_is_rejected() {
        JwtService otherKey = new JwtService(TestAuthProperties.withJwt(new AuthProperties.Jwt(
                TestAuthProperties.ISSUER, TestAuthProperties.AUDIENCE,
                "a-completely-different-secret-of-enough-length", 900)), clock);
        String forged = otherKey.issue(subject()).token();

        assertThat(jwtService.hasValidSigningAlgorithm(forged)).isTrue();
        assertThat(jwtService.parseExpired(forged)).isEmpty();
        assertThatThrownBy(() -> jwtService.verifyAccessToken(forged))
                .isInstanceOf(JwtService.InvalidJwtException.class);
    }

    @Test
    @DisplayName("alg=none 토큰은 알고리즘 검사에서 거절")
    void unsigned_token_is_rejected() {
        String unsigned = Jwts.builder()
                .setId("jti-none")
                .setIssuer(TestAuthProperties.ISSUER)
                .setAudience(TestAuthProperties.AUDIENCE)
                .setSubject("42")
                .setExpiration(Date.from(clock.instant().plusSeconds(60)))
                .compact();

        assertThat(jwtService.hasValidSigningAlgorithm(unsigned)).isFalse();
        assertThat(jwtService.parseExpired(unsigned)).isEmpty();
        assertThatThrownBy(() -> jwtService.verifyAccessToken(unsigned))
                .isInstanceOf(JwtService.InvalidJwtException.class);
    }

    @Test
    @DisplayName("설정과 다른 알고리즘(HS512)으로 서명된 토큰은 거절")
    void other_algorithm_is_rejected() {
        byte[] key = "another-secret-another-secret-another-secret-another-secret-0123"
                .getBytes(StandardCharsets.UTF_8);
        String hs512 = Jwts.builder()
                .setId("jti-512")
                .setIssuer(TestAuthProperties.ISSUER)
                .setAudience(TestAuthProperties.AUDIENCE)
                .setSubject("42")
                .setExpiration(Date.from(clock.instant().plusSeconds(60)))
                .signWith(Keys.hmacShaKeyFor(key), SignatureAlgorithm.HS512)
                .compact();

        assertThat(jwtService.hasValidSigningAlgorithm(hs512)).isFalse();
        assertThat(jwtService.parseExpired(hs512)).isEmpty();
    }

    @Test
    @DisplayName("header.alg 는 대소문자까지 정확히 HS256 이어야 한다 (hs256 거절)")
    void algorithm_name_is_case_sensitive() {
        IssuedAccessToken issued = jwtService.issue(subject());
        String token = issued.token();
        String lowerCaseHeader = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"alg\":\"hs256\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));
        String tampered = lowerCaseHeader + token.substring(token.indexOf('.'));

        assertThat(jwtService.hasValidSigningAlgorithm(token)).isTrue();
        assertThat(jwtService.hasValidSigningAlgorithm(tampered)).isFalse();
        assertThat(jwtService.parseExpired(tampered)).isEmpty();
    }

    @Test
    @DisplayName("다른 issuer 로 발급된 토큰은 만료 여부와 상관없이 거절")
    void foreign_issuer_is_rejected() {
        JwtService foreign = new JwtService(TestAuthProperties.withJwt(new AuthProperties.Jwt(
                "someone-else", TestAuthProperties.AUDIENCE, TestAuthProperties.SECRET, 900)), clock);
        String token = foreign.issue(subject()).token();
        clock.advance(Duration.ofHours(1));

        assertThat(jwtService.parseExpired(token)).isEmpty();
    }

    @Test
    @DisplayName("형식이 깨진 입력은 예외 없이 empty / false")
    void garbage_input_never_throws() {
        assertThat(jwtService.parseExpired(null)).isEmpty();
        assertThat(jwtService.parseExpired("")).isEmpty();
        assertThat(jwtService.parseExpired("not-a-jwt")).isEmpty();
        assertThat(jwtService.parseExpired("a.b.c")).isEmpty();
        assertThat(jwtService.hasValidSigningAlgorithm("%%%.x.y")).isFalse();
    }

    @Test
    @DisplayName("32바이트 미만 서명키는 기동 실패")
    void weak_secret_fails_fast() {
        AuthProperties weak = TestAuthProperties.withJwt(new AuthProperties.Jwt(
                TestAuthProperties.ISSUER, TestAuthProperties.AUDIENCE, "too-short", 900));

        assertThatThrownBy(() -> new JwtService(weak, clock))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("iat / exp 는 초 단위로 잘린다")
    void timestamps_are_second_precision() {
        clock.advance(Duration.ofMillis(1500));
        IssuedAccessToken issued = jwtService.issue(subject());

        AccessTokenClaims claims = jwtService.parseExpired(issued.token()).orElseThrow();
        assertThat(claims.issuedAt()).isEqualTo(Instant.parse("2026-01-01T00:00:01Z"));
        assertThat(claims.expiresAt()).isEqualTo(issued.expiresAt());
    }
}
