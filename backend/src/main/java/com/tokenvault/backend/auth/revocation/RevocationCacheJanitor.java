package com.tokenvault.backend.auth.revocation;

import java.time.Duration;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import com.tokenvault.backend.auth.config.AuthProperties;
import com.tokenvault.backend.auth.support.PeriodicBackgroundTask;

/**
 * 만료된 폐기 항목을 메모리에서 실제로 내보낸다.
 * - 조회 정확성과는 무관 (만료 항목은 조회 시 이미 없는 것으로 보임)
 */
@Component
public class RevocationCacheJanitor extends PeriodicBackgroundTask {

    private final RevocationCache revocationCache;

    public RevocationCacheJanitor(TaskScheduler authTaskScheduler,
                                  RevocationCache revocationCache,
                                  AuthProperties props) {
        super("revocation-cache-cleanup",
                authTaskScheduler,
                Duration.ofSeconds(props.revocation().cleanupIntervalSeconds()),
                Duration.ofSeconds(props.revocation().cleanupIntervalSeconds()),
                Duration.ofSeconds(props.revocation().cleanupIntervalSeconds()));
        this.revocationCache = revocationCache;
    }

    @Override
    protected void runOnce() {
        revocationCache.cleanUp();
    }
}
