package com.tokenvault.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class AuthModuleConfig {

    @Bean
    public Clock clock() {
        // 토큰 만료/폐기 시각은 전부 UTC 기준
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        // Refresh Token 값 생성용 (TokenGenerator)
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * RefreshTokenService 전용 프로그래밍 방식 트랜잭션
     * - 커밋 시점의 락/버전 충돌까지 서비스 안에서 잡아서 Optional/Result로 바꾸기 위함
     */
    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    /**
     * 백그라운드 작업(만료 토큰 청소, 폐기 캐시 정리) 전용 스케줄러
     * - 요청 처리 스레드와 분리되어 있어서 청소 작업이 실패/지연돼도 로그인은 막히지 않는다.
     */
    @Bean
    public ThreadPoolTaskScheduler authTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("auth-bg-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
