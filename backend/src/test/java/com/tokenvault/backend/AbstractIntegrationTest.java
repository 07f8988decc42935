package com.tokenvault.backend;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import com.tokenvault.backend.auth.revocation.RevocationCache;
import com.tokenvault.backend.auth.token.repo.RefreshTokenRepository;
import com.tokenvault.backend.auth.user.UserDirectory;
import com.tokenvault.backend.auth.user.UserRepository;
import com.tokenvault.backend.support.MutableClock;
import com.tokenvault.backend.support.TestClockConfig;

/**
 * 통합테스트 공통 베이스
 * - test 프로필: H2(MySQL 모드) + create-drop, 청소 작업 끔, 동시 세션 제한 3
 * - 매 테스트마다 DB / 폐기 캐시 / 시계를 같은 초기 상태로 되돌린다.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class AbstractIntegrationTest {

    protected static final String USERNAME = "alice";
    protected static final String EMAIL = "alice@example.com";
    protected static final String PASSWORD = "s3cret-Passw0rd!";

    @Autowired protected UserRepository userRepository;
    @Autowired protected RefreshTokenRepository refreshTokenRepository;
    @Autowired protected UserDirectory userDirectory;
    @Autowired protected RevocationCache revocationCache;
    @Autowired protected MutableClock clock;

    @BeforeEach
    void resetState() {
        refreshTokenRepository.deleteAll();
        userRepository.deleteAll();
        revocationCache.invalidateAll();
        clock.reset();
    }

    protected Long seedUser(String username, String email) {
        return userDirectory.register(username, email, PASSWORD, "Test", "User").getId();
    }
}
