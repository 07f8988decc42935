package com.tokenvault.backend.auth.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.springframework.stereotype.Component;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.tokenvault.backend.auth.config.AuthProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Access Token 폐기 캐시 (jti -> 폐기 시각)
 *
 * - 서명만으로는 "아직 만료 전인데 로그아웃된 토큰"을 거를 수 없어서 jti 블랙리스트를 둔다.
 * - 항목마다 TTL이 다르다. (기본 24시간, 보통은 짝 Access Token의 남은 수명)
 *   -> Caffeine Expiry 로 항목별 만료, 만료된 항목은 조회 시점에 없는 것으로 취급
 * - 같은 jti를 다시 revoke 하면 덮어쓴다. (TTL도 새 값으로)
 * - 조회는 메모리 O(1), 외부 락 없이 스레드 안전
 * - 크기 상한 없음: 항목은 TTL 이 지나야만 빠진다. (용량 초과로 밀려나면 폐기된 토큰이 다시 통과)
 * - TTL 은 최대 MAX_TTL(1년)
 *
 * 프로세스 로컬 캐시라서 재시작하면 비어 있다. (RevokedTokensWarmup 이 DB에서 다시 채움)
 */
@Slf4j
@Component
public class RevocationCache {

    static final Duration MAX_TTL = Duration.ofDays(365);

    private final Cache<String, Entry> cache;
    private final Duration defaultTtl;
    private final Clock clock;

    public RevocationCache(AuthProperties props, Clock clock) {
        this.defaultTtl = Duration.ofSeconds(props.revocation().defaultTtlSeconds());
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfter(new PerEntryTtl())
                .build();
    }

    /** 기본 TTL(24h)로 폐기 */
    public void revoke(String jwtId) {
        revoke(jwtId, defaultTtl);
    }

    /**
     * ttl 이 0 이하면 이미 만료된 Access Token -> 넣을 필요 없음
     */
    public void revoke(String jwtId, Duration ttl) {
        if (jwtId == null || jwtId.isBlank())
            return;

        Duration effective = ttl == null ? defaultTtl : ttl;
        if (effective.isZero() || effective.isNegative())
            return;

        if (effective.compareTo(MAX_TTL) > 0)
            effective = MAX_TTL;

        cache.put(jwtId, new Entry(clock.instant(), effective));
        log.debug("Access token {} revoked for {}", jwtId, effective);
    }

    public boolean isRevoked(String jwtId) {
        if (jwtId == null || jwtId.isBlank())
            return false;
        return cache.getIfPresent(jwtId) != null;
    }

    /** 만료 항목 정리 (RevocationCacheJanitor 가 주기적으로 호출) */
    public void cleanUp() {
        cache.cleanUp();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.estimatedSize();
    }

    record Entry(Instant revokedAt, Duration ttl) {}

    /**
     * 쓰기(덮어쓰기 포함) 시점부터 항목의 ttl 만큼 산다. 읽기는 수명을 늘리지 않는다.
     */
    private static final class PerEntryTtl implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
