package com.tokenvault.backend.auth.token.service;

import java.time.Duration;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import com.tokenvault.backend.auth.config.AuthProperties;
import com.tokenvault.backend.auth.support.PeriodicBackgroundTask;

import lombok.extern.slf4j.Slf4j;

/**
 * 만료/오래 전에 폐기된 refresh_tokens row 청소 (기본 6시간마다, 실패 시 30분 뒤 재시도)
 */
@Slf4j
@Component
public class RefreshTokenSweeper extends PeriodicBackgroundTask {

    private final RefreshTokenService refreshTokenService;
    private final boolean enabled;

    public RefreshTokenSweeper(TaskScheduler authTaskScheduler,
                               RefreshTokenService refreshTokenService,
                               AuthProperties props) {
        super("refresh-token-sweep",
                authTaskScheduler,
                Duration.ofSeconds(props.sweep().initialDelaySeconds()),
                Duration.ofSeconds(props.sweep().intervalSeconds()),
                Duration.ofSeconds(props.sweep().errorBackoffSeconds()));
        this.refreshTokenService = refreshTokenService;
        this.enabled = props.sweep().enabled();
    }

    @Override
    protected void runOnce() {
        int deleted = refreshTokenService.sweepExpired();
        log.debug("Refresh token sweep removed {} row(s)", deleted);
    }

    @Override
    protected boolean isEnabled() {
        return enabled;
    }
}
