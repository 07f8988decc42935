package com.tokenvault.backend.auth.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.tokenvault.backend.auth.config.AuthProperties;
import com.tokenvault.backend.auth.token.service.RefreshTokensRevokedEvent;
import com.tokenvault.backend.auth.token.service.RefreshTokensRevokedEvent.PairedAccessToken;

import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 폐기가 커밋된 뒤, 짝 Access Token의 jti를 폐기 캐시에 넣는다.
 *
 * - AFTER_COMMIT: 롤백된 폐기는 캐시에 반영되지 않는다.
 * - TTL = (발급 시각 + Access TTL) - now. 이미 만료된 Access Token은 건너뛴다.
 */
@Slf4j
@Component
public class RevokedRefreshTokenListener {

    private final RevocationCache revocationCache;
    private final Duration accessTtl;
    private final Clock clock;

    public RevokedRefreshTokenListener(RevocationCache revocationCache, AuthProperties props, Clock clock) {
        this.revocationCache = revocationCache;
        this.accessTtl = Duration.ofSeconds(props.jwt().accessTtlSeconds());
        this.clock = clock;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void on(RefreshTokensRevokedEvent event) {
        int cached = 0;
        for (PairedAccessToken access : event.accessTokens()) {
            Duration remaining = remainingLifetime(access.issuedAt());
            if (remaining.isZero() || remaining.isNegative())
                continue;
            revocationCache.revoke(access.jwtId(), remaining);
            cached++;
        }
        log.debug("Revoked {} paired access token(s) of user {} (reason {})", cached, event.userId(), event.reason());
    }

    Duration remainingLifetime(LocalDateTime issuedAt) {
        if (issuedAt == null)
            return accessTtl;
        return Duration.between(clock.instant(), issuedAt.toInstant(ZoneOffset.UTC).plus(accessTtl));
    }
}
