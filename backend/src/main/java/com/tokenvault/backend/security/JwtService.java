package com.tokenvault.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenvault.backend.auth.config.AuthProperties;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

/**
 * Access Token(JWT) 발급/검증 서비스
 * - 서버가 매번 DB를 조회하지 않고도(Stateless) 서명 검증만으로 "내가 발급한 토큰"인지 확인 가능
 *
 * JWT 구조: header.payload.signature
 * - header: 알고리즘/타입 정보 (HS256)
 * - payload: jti / iss / aud / sub / username / email / roles / clientId / iat / exp
 * - signature: header.payload를 서버 비밀키로 서명한 값(HMAC-SHA256)
 *
 * 발급: issue(subject) - 새 jti를 만들어 서명한 토큰 + jti + 만료 시각 반환
 * 검증: verifyAccessToken(token) - 서명/만료/issuer/audience 검증 후 AuthPrincipal로 복원 (실패 시 예외)
 * 재발급용: parseExpired(token) - 만료만 무시하고 클레임 복원 (실패 시 Optional.empty, 예외 없음)
 * 알고리즘 고정: hasValidSigningAlgorithm(token) - header.alg가 HS256이 아니면 거절 ("none" 공격 방어)
 */
@Slf4j
@Service
public class JwtService {

    static final SignatureAlgorithm SIGNING_ALGORITHM = SignatureAlgorithm.HS256;

    static final String USERNAME_CLAIM = "username";
    static final String EMAIL_CLAIM = "email";
    static final String ROLES_CLAIM = "roles";
    static final String CLIENT_ID_CLAIM = "clientId";

    private static final int MIN_SECRET_BYTES = 32;

    // header 디코딩 전용 (서명 검증 전에 alg만 본다)
    private static final ObjectMapper om = new ObjectMapper();

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser jwtParser;

    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;

        byte[] secretBytes = jwtProps.secret().getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        this.key = Keys.hmacShaKeyFor(secretBytes);

        /**
         * 파서 하나를 만들어 재사용
         * - 서명 키 / issuer / audience 강제
         * - 만료 판단은 jjwt 기본 시스템 시계가 아니라 주입받은 Clock 기준
         */
        this.jwtParser = Jwts.parserBuilder()
                .requireIssuer(jwtProps.issuer())
                .requireAudience(jwtProps.audience())
                .setSigningKey(this.key)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    public IssuedAccessToken issue(AccessTokenSubject subject) {
        if (subject == null || subject.userId() == null) {
            throw new IllegalArgumentException("userId must not be null");
        }

        // JWT의 iat/exp는 초 단위라서 반환값도 초 단위로 맞춘다
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant exp = now.plusSeconds(jwtProps.accessTtlSeconds());
        String jwtId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .setId(jwtId)                                  // jti
                .setIssuer(jwtProps.issuer())                  // iss
                .setAudience(jwtProps.audience())              // aud
                .setSubject(String.valueOf(subject.userId()))  // sub
                .claim(USERNAME_CLAIM, subject.username())
                .claim(EMAIL_CLAIM, subject.email())
                .claim(ROLES_CLAIM, List.copyOf(new TreeSet<>(subject.roles())))
                .claim(CLIENT_ID_CLAIM, subject.clientId())
                .setIssuedAt(Date.from(now))                   // iat
                .setExpiration(Date.from(exp))                 // exp
                .signWith(key, SIGNING_ALGORITHM)
                .compact();

        return new IssuedAccessToken(token, jwtId, exp);
    }

    /**
     * Access Token 검증 후, AuthPrincipal 리턴
     *
     * 실패하면 InvalidJwtException을 던진다
     * - Filter에서 잡아서 401 JSON으로 변환
     */
    public AuthPrincipal verifyAccessToken(String token) {
        try {
            if (token == null || token.isBlank())
                throw new JwtException("token is null or blank");
            if (!hasValidSigningAlgorithm(token))
                throw new JwtException("unexpected signing algorithm");

            AccessTokenClaims claims = toAccessClaims(jwtParser.parseClaimsJws(token).getBody());
            return new AuthPrincipal(
                    claims.userId(),
                    claims.username(),
                    claims.roles(),
                    claims.jwtId(),
                    claims.expiresAt());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid JWT", e);
        }
    }

    /**
     * 만료된 Access Token에서 클레임 복원 (refresh 요청 인가용)
     *
     * - 서명/구조/issuer/audience는 그대로 검증, exp만 무시한다.
     * - 어떤 실패든 Optional.empty() -> 호출자는 "refresh 거절"로만 취급 (재시도 대상 아님)
     */
    public Optional<AccessTokenClaims> parseExpired(String token) {
        if (token == null || token.isBlank())
            return Optional.empty();

        if (!hasValidSigningAlgorithm(token)) {
            log.debug("Rejected token with unexpected signing algorithm");
            return Optional.empty();
        }

        try {
            Claims claims;
            try {
                claims = jwtParser.parseClaimsJws(token).getBody();
            } catch (ExpiredJwtException e) {
                // jjwt는 서명 검증을 통과한 뒤에야 만료를 판단한다 -> 여기 claims는 서명이 검증된 값
                claims = e.getClaims();
            }
            return Optional.of(toAccessClaims(claims));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Failed to parse access token for refresh: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * header.alg가 설정된 알고리즘(HS256)인지 확인
     * - 외부에서 들어온 토큰의 클레임을 믿기 전에 반드시 먼저 호출
     */
    public boolean hasValidSigningAlgorithm(String token) {
        if (token == null || token.isBlank())
            return false;

        int dot = token.indexOf('.');
        if (dot <= 0)
            return false;

        try {
            byte[] headerJson = Base64.getUrlDecoder().decode(token.substring(0, dot));
            JsonNode alg = om.readTree(headerJson).get("alg");
            return alg != null
                    && alg.isTextual()
                    && SIGNING_ALGORITHM.getValue().equals(alg.asText());
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    public long accessTtlSeconds() {
        return jwtProps.accessTtlSeconds();
    }

    private AccessTokenClaims toAccessClaims(Claims claims) {
        // 만료 토큰 경로에서는 jjwt가 issuer/audience 검증 전에 멈추므로 여기서 한 번 더 확인
        if (!jwtProps.issuer().equals(claims.getIssuer()))
            throw new JwtException("unexpected issuer");
        if (!jwtProps.audience().equals(claims.getAudience()))
            throw new JwtException("unexpected audience");

        String jwtId = claims.getId();
        if (jwtId == null || jwtId.isBlank())
            throw new JwtException("jti claim missing");

        return new AccessTokenClaims(
                jwtId,
                parseUserId(claims),
                claims.get(USERNAME_CLAIM, String.class),
                claims.get(EMAIL_CLAIM, String.class),
                parseRoles(claims),
                claims.get(CLIENT_ID_CLAIM, String.class),
                toInstant(claims.getIssuedAt()),
                toInstant(claims.getExpiration()));
    }

    // subject:userId -> Long userId 파싱
    private static Long parseUserId(Claims claims) {
        String sub = claims.getSubject();
        if (sub == null || sub.isBlank())
            throw new JwtException("subject (userId) is missing");

        try {
            return Long.valueOf(sub);
        } catch (NumberFormatException ex) {
            throw new JwtException("subject is not a valid Long: " + sub, ex);
        }
    }

    private static Set<String> parseRoles(Claims claims) {
        Object raw = claims.get(ROLES_CLAIM);
        if (!(raw instanceof Collection))
            return Set.of();

        Set<String> roles = new LinkedHashSet<>();
        for (Object value : (Collection<?>) raw) {
            if (value != null)
                roles.add(value.toString());
        }
        return Set.copyOf(roles);
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    /**
     * "HTTP를 모르는 도메인 예외"
     * - Filter에서 잡아서 401로 매핑하여 처리
     */
    public static class InvalidJwtException extends RuntimeException {
        public InvalidJwtException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
