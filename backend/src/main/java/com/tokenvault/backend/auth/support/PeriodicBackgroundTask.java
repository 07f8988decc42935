package com.tokenvault.backend.auth.support;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import lombok.extern.slf4j.Slf4j;

/**
 * 주기적 백그라운드 작업의 공통 뼈대
 *
 * - 컨텍스트 시작 시 initialDelay 뒤에 첫 실행
 * - 성공하면 interval 뒤, 실패하면 errorBackoff 뒤에 다시 실행 (실패가 작업을 죽이지 않는다)
 * - 다음 실행은 직전 실행이 끝난 뒤에 예약한다. (겹쳐서 돌지 않음)
 * - 종료 시 예약된 실행을 취소(interrupt)하고, 종료 중에 난 예외는 에러 로그로 남기지 않는다.
 *
 * 요청 처리 스레드가 아니라 authTaskScheduler 스레드에서 돈다.
 */
@Slf4j
public abstract class PeriodicBackgroundTask implements SmartLifecycle {

    private final String name;
    private final TaskScheduler scheduler;
    private final Duration initialDelay;
    private final Duration interval;
    private final Duration errorBackoff;

    private final Object monitor = new Object();
    private volatile boolean running;
    private ScheduledFuture<?> next;

    protected PeriodicBackgroundTask(String name, TaskScheduler scheduler,
                                     Duration initialDelay, Duration interval, Duration errorBackoff) {
        this.name = name;
        this.scheduler = scheduler;
        this.initialDelay = initialDelay;
        this.interval = interval;
        this.errorBackoff = errorBackoff;
    }

    /**
     * 한 번 실행할 작업. 예외를 던지면 errorBackoff 뒤에 재시도
     */
    protected abstract void runOnce() throws Exception;

    protected boolean isEnabled() {
        return true;
    }

    @Override
    public void start() {
        if (!isEnabled()) {
            log.info("Background task {} is disabled", name);
            return;
        }
        synchronized (monitor) {
            if (running)
                return;
            running = true;
            log.info("Background task {} started (interval {}, error backoff {})", name, interval, errorBackoff);
            scheduleNext(initialDelay);
        }
    }

    @Override
    public void stop() {
        synchronized (monitor) {
            running = false;
            if (next != null) {
                next.cancel(true);
                next = null;
            }
        }
        log.info("Background task {} stopped", name);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** 한 사이클 실행 + 다음 예약 (스케줄러 스레드에서 호출) */
    void execute() {
        if (!running)
            return;

        Duration delay;
        try {
            runOnce();
            delay = interval;
        } catch (Exception e) {
            if (!running || Thread.currentThread().isInterrupted()) {
                log.debug("Background task {} interrupted during shutdown", name);
                return;
            }
            log.error("Background task {} failed; retrying in {}", name, errorBackoff, e);
            delay = errorBackoff;
        }

        synchronized (monitor) {
            scheduleNext(delay);
        }
    }

    // monitor 를 잡은 상태에서만 호출
    private void scheduleNext(Duration delay) {
        if (!running)
            return;
        try {
            next = scheduler.schedule(this::execute, scheduler.getClock().instant().plus(delay));
        } catch (TaskRejectedException e) {
            // 스케줄러가 먼저 내려간 경우 (컨텍스트 종료 중)
            log.debug("Background task {} could not be rescheduled: {}", name, e.getMessage());
            running = false;
        }
    }

    public String getName() {
        return name;
    }
}
