package com.tokenvault.backend.auth.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.tokenvault.backend.auth.config.AuthProperties;
import com.tokenvault.backend.auth.token.domain.RefreshToken;
import com.tokenvault.backend.auth.token.repo.RefreshTokenRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * 기동 시 폐기 캐시 채우기
 *
 * 캐시가 프로세스 로컬이라 재시작하면 비어버린다.
 * -> 짝 Access Token이 아직 살아있을 수 있는(발급 후 accessTtl 이내) 폐기 토큰의 jti를 다시 넣는다.
 * 실패해도 기동은 계속한다. (에러 로그만)
 */
@Slf4j
@Component
public class RevokedTokensWarmup implements ApplicationRunner {

    private final RefreshTokenRepository refreshTokenRepository;
    private final RevokedRefreshTokenListener listener;
    private final RevocationCache revocationCache;
    private final AuthProperties props;
    private final Clock clock;

    public RevokedTokensWarmup(RefreshTokenRepository refreshTokenRepository,
                               RevokedRefreshTokenListener listener,
                               RevocationCache revocationCache,
                               AuthProperties props,
                               Clock clock) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.listener = listener;
        this.revocationCache = revocationCache;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.revocation().warmUpOnStartup())
            return;
        warmUp();
    }

    public int warmUp() {
        log.info("Loading revoked tokens into revocation cache...");
        try {
            LocalDateTime issuedAfter = LocalDateTime.now(clock).minusSeconds(props.jwt().accessTtlSeconds());
            List<RefreshToken> revoked = refreshTokenRepository.findRevokedIssuedAfter(issuedAfter);

            int loaded = 0;
            for (RefreshToken rt : revoked) {
                Duration remaining = listener.remainingLifetime(rt.getCreatedAt());
                if (remaining.isZero() || remaining.isNegative())
                    continue;
                revocationCache.revoke(rt.getJwtId(), remaining);
                loaded++;
            }
            log.info("Loaded {} revoked tokens into revocation cache", loaded);
            return loaded;
        } catch (RuntimeException e) {
            log.error("Error loading revoked tokens into revocation cache", e);
            return 0;
        }
    }
}
