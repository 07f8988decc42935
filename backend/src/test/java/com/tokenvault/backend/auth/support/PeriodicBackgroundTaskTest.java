package com.tokenvault.backend.auth.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

@DisplayName("[Support] PeriodicBackgroundTask 스케줄링 / 실패 백오프 / 종료")
class PeriodicBackgroundTaskTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static final Duration INITIAL = Duration.ofSeconds(5);
    private static final Duration INTERVAL = Duration.ofMinutes(10);
    private static final Duration BACKOFF = Duration.ofSeconds(30);

    TaskScheduler scheduler;
    ScheduledFuture<?> future;

    @BeforeEach
    void setUp() {
        scheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        when(scheduler.getClock()).thenReturn(Clock.fixed(NOW, ZoneOffset.UTC));
        doReturn(future).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    /** runOnce 동작을 바꿔 끼울 수 있는 테스트용 작업 */
    static class CountingTask extends PeriodicBackgroundTask {

        final AtomicInteger runs = new AtomicInteger();
        volatile RuntimeException failure;
        volatile boolean enabled = true;

        CountingTask(TaskScheduler scheduler) {
            super("counting", scheduler, INITIAL, INTERVAL, BACKOFF);
        }

        @Override
        protected void runOnce() {
            runs.incrementAndGet();
            if (failure != null)
                throw failure;
        }

        @Override
        protected boolean isEnabled() {
            return enabled;
        }
    }

    private List<Instant> scheduledInstants(int expectedCalls) {
        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(scheduler, times(expectedCalls)).schedule(any(Runnable.class), at.capture());
        return at.getAllValues();
    }

    @Test
    @DisplayName("start: initialDelay 뒤에 첫 실행 예약, 두 번 불러도 한 번만")
    void start_schedules_first_run_once() {
        CountingTask task = new CountingTask(scheduler);

        task.start();
        task.start();

        assertThat(task.isRunning()).isTrue();
        assertThat(scheduledInstants(1)).containsExactly(NOW.plus(INITIAL));
    }

    @Test
    @DisplayName("비활성이면 아무것도 예약하지 않는다")
    void disabled_task_never_schedules() {
        CountingTask task = new CountingTask(scheduler);
        task.enabled = false;

        task.start();

        assertThat(task.isRunning()).isFalse();
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("성공하면 interval 뒤, 실패하면 errorBackoff 뒤에 다시 실행")
    void success_uses_interval_and_failure_uses_backoff() {
        CountingTask task = new CountingTask(scheduler);
        task.start();

        task.execute();
        task.failure = new IllegalStateException("db down");
        task.execute();
        task.failure = null;
        task.execute();

        assertThat(task.runs).hasValue(3);
        assertThat(scheduledInstants(4)).containsExactly(
                NOW.plus(INITIAL),
                NOW.plus(INTERVAL),
                NOW.plus(BACKOFF),
                NOW.plus(INTERVAL));
        assertThat(task.isRunning()).isTrue();
    }

    @Test
    @DisplayName("예약된 Runnable 을 실행하면 runOnce 가 돈다")
    void scheduled_runnable_invokes_run_once() {
        CountingTask task = new CountingTask(scheduler);
        task.start();

        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(captor.capture(), any(Instant.class));
        captor.getValue().run();

        assertThat(task.runs).hasValue(1);
    }

    @Test
    @DisplayName("stop: 예약 취소(interrupt) 후에는 실행/재예약 없음")
    void stop_cancels_and_prevents_further_runs() {
        CountingTask task = new CountingTask(scheduler);
        task.start();

        task.stop();
        task.execute();

        verify(future).cancel(true);
        assertThat(task.isRunning()).isFalse();
        assertThat(task.runs).hasValue(0);
        scheduledInstants(1);
    }

    @Test
    @DisplayName("스케줄러가 먼저 내려가 재예약이 거절되면 작업도 멈춘다")
    void rejected_reschedule_stops_task() {
        CountingTask task = new CountingTask(scheduler);
        task.start();

        doThrow(new TaskRejectedException("shut down"))
                .when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        task.execute();

        assertThat(task.runs).hasValue(1);
        assertThat(task.isRunning()).isFalse();
    }

    @Test
    @DisplayName("이름은 로그 / 식별용으로 그대로 노출")
    void exposes_name() {
        assertThat(new CountingTask(scheduler).getName()).isEqualTo("counting");
    }
}
