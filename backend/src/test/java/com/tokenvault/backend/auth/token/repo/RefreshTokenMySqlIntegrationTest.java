package com.tokenvault.backend.auth.token.repo;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.tokenvault.backend.AbstractIntegrationTest;
import com.tokenvault.backend.auth.token.domain.RefreshRevokeReason;
import com.tokenvault.backend.auth.token.domain.RefreshToken;
import com.tokenvault.backend.auth.token.service.RefreshTokenService;

/**
 * 실제 MySQL + Flyway 스키마 위에서 라이프사이클 확인 (Docker 없으면 skip)
 *
 * - H2 로는 확인이 안 되는 것: ascii_bin 토큰 컬럼, FK ON DELETE CASCADE, 행 잠금
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("[MySQL] refresh_tokens 스키마 / 라이프사이클")
class RefreshTokenMySqlIntegrationTest extends AbstractIntegrationTest {

    @Container
    static final MySQLContainer<?> MYSQL = new MySQLContainer<>("mysql:8.0.36")
            .withDatabaseName("tokenvault_test")
            .withUsername("tokenvault")
            .withPassword("tokenvault")
            .withStartupAttempts(3)
            .withStartupTimeout(Duration.ofMinutes(2));

    @DynamicPropertySource
    static void overrideProps(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", MYSQL::getJdbcUrl);
        r.add("spring.datasource.username", MYSQL::getUsername);
        r.add("spring.datasource.password", MYSQL::getPassword);
        r.add("spring.datasource.driver-class-name", () -> "com.mysql.cj.jdbc.Driver");
        r.add("spring.datasource.hikari.connection-timeout", () -> "30000");

        // 스키마는 Flyway 마이그레이션 그대로
        r.add("spring.flyway.enabled", () -> "true");
        r.add("spring.jpa.hibernate.ddl-auto", () -> "none");
    }

    @Autowired RefreshTokenService refreshTokenService;

    @Test
    @DisplayName("발급 -> 회전 -> 전체 폐기: 체인과 폐기 사유가 그대로 저장된다")
    void lifecycle_on_mysql() {
        Long userId = seedUser(USERNAME, EMAIL);

        RefreshToken first = refreshTokenService.create(userId, "jti-1", "203.0.113.10", "JUnit").orElseThrow();
        clock.advance(Duration.ofSeconds(1));
        RefreshToken second = refreshTokenService.rotate(first, "jti-2", "203.0.113.10", null).orElseThrow();

        RefreshToken reloadedFirst = refreshTokenRepository.findById(first.getToken()).orElseThrow();
        assertThat(reloadedFirst.isRotated()).isTrue();
        assertThat(reloadedFirst.getReplacedByToken()).isEqualTo(second.getToken());
        assertThat(reloadedFirst.getRevokeReason()).isEqualTo(RefreshRevokeReason.ROTATED.name());

        assertThat(refreshTokenService.revokeAllForUser(userId, "203.0.113.10", null).isFailure()).isFalse();
        assertThat(refreshTokenRepository.findById(second.getToken()).orElseThrow().getRevokeReason())
                .isEqualTo(RefreshRevokeReason.ALL_SESSIONS_REVOKED.name());
        assertThat(refreshTokenService.validate(second.getToken(), "jti-2", userId)).isEmpty();
    }

    @Test
    @DisplayName("토큰 컬럼은 대소문자를 구분한다 (ascii_bin)")
    void token_lookup_is_case_sensitive() {
        Long userId = seedUser(USERNAME, EMAIL);
        LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);

        refreshTokenRepository.saveAndFlush(
                RefreshToken.issue("AbCdEfGhIjKl", "jti-upper", userId, now, now.plusDays(7), null, null));
        refreshTokenRepository.saveAndFlush(
                RefreshToken.issue("abcdefghijkl", "jti-lower", userId, now, now.plusDays(7), null, null));

        assertThat(refreshTokenRepository.findById("AbCdEfGhIjKl").orElseThrow().getJwtId()).isEqualTo("jti-upper");
        assertThat(refreshTokenRepository.findById("ABCDEFGHIJKL")).isEmpty();
        assertThat(refreshTokenRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("유저 삭제 시 refresh_tokens 도 FK CASCADE 로 같이 지워진다")
    void deleting_user_cascades_to_tokens() {
        Long userId = seedUser(USERNAME, EMAIL);
        refreshTokenService.create(userId, "jti-1", null, null).orElseThrow();
        refreshTokenService.create(userId, "jti-2", null, null).orElseThrow();
        assertThat(refreshTokenRepository.count()).isEqualTo(2);

        userRepository.deleteById(userId);

        assertThat(refreshTokenRepository.count()).isZero();
    }
}
