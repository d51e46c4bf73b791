package com.hostwatch.service;

import com.hostwatch.TestSnapshots;
import com.hostwatch.collector.Category;
import com.hostwatch.dto.CollectionResult;
import com.hostwatch.dto.RefreshStatus;
import com.hostwatch.dto.SchedulerState;
import com.hostwatch.dto.SystemSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefreshSchedulerTest {

    private static final Instant T1 = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private SnapshotManager manager;
    @Mock
    private SnapshotBroadcaster broadcaster;

    private final Clock clock = Clock.fixed(T1, ZoneOffset.UTC);
    private final ExecutorService background = Executors.newSingleThreadExecutor();
    private RefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new RefreshScheduler(manager, broadcaster, clock, 5, true);
    }

    @AfterEach
    void tearDown() {
        background.shutdownNow();
    }

    @Test
    void initialState_isIdleWithAutoRefreshEnabled() {
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.IDLE);
        assertThat(scheduler.isAutoRefreshEnabled()).isTrue();
        assertThat(scheduler.getLatestSnapshot()).isEmpty();
        assertThat(scheduler.getLastResult()).isEmpty();
    }

    @Test
    void timerTick_autoRefreshEnabled_collectsAndPublishes() {
        CollectionResult success = CollectionResult.success(TestSnapshots.snapshot(T1));
        when(manager.collect()).thenReturn(success);

        assertThat(scheduler.onTimerTick()).isTrue();

        assertThat(scheduler.getLatestSnapshot()).contains(success.snapshot());
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.IDLE);
        verify(broadcaster).publish(success);
    }

    @Test
    void timerTick_autoRefreshDisabled_doesNotCollect() {
        scheduler.toggleAutoRefresh();

        assertThat(scheduler.onTimerTick()).isFalse();

        verify(manager, never()).collect();
        verify(broadcaster, never()).publish(any());
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.IDLE);
        assertThat(scheduler.getLatestSnapshot()).isEmpty();
    }

    @Test
    void manualRefresh_autoRefreshDisabled_stillCollects() {
        scheduler.toggleAutoRefresh();
        when(manager.collect()).thenReturn(CollectionResult.success(TestSnapshots.snapshot(T1)));

        Optional<CollectionResult> result = scheduler.triggerManualRefresh();

        assertThat(result).isPresent();
        assertThat(result.get().isSuccess()).isTrue();
        assertThat(scheduler.getLatestSnapshot()).isPresent();
        assertThat(scheduler.isAutoRefreshEnabled()).isFalse();
    }

    @Test
    void toggle_flipsFlagWithoutCollecting() {
        assertThat(scheduler.toggleAutoRefresh()).isFalse();
        assertThat(scheduler.isAutoRefreshEnabled()).isFalse();
        assertThat(scheduler.toggleAutoRefresh()).isTrue();
        assertThat(scheduler.isAutoRefreshEnabled()).isTrue();

        verify(manager, never()).collect();
        verify(broadcaster, times(2)).publishStatus(any(RefreshStatus.class));
    }

    @Test
    void triggersWhileCollecting_areDropped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CollectionResult success = CollectionResult.success(TestSnapshots.snapshot(T1));
        when(manager.collect()).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return success;
        });

        Callable<Boolean> tick = scheduler::onTimerTick;
        Future<Boolean> inFlight = background.submit(tick);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(scheduler.getState()).isEqualTo(SchedulerState.COLLECTING);
        assertThat(scheduler.triggerManualRefresh()).isEmpty();
        assertThat(scheduler.onTimerTick()).isFalse();

        release.countDown();
        assertThat(inFlight.get(5, TimeUnit.SECONDS)).isTrue();

        verify(manager, times(1)).collect();
        verify(broadcaster, times(1)).publish(any());
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.IDLE);
        assertThat(scheduler.getStatus().droppedTriggers()).isEqualTo(2);
        assertThat(scheduler.getStatus().completedCycles()).isEqualTo(1);
    }

    @Test
    void toggleWhileCollecting_doesNotAbortInFlightCycle() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(manager.collect()).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return CollectionResult.success(TestSnapshots.snapshot(T1));
        });

        Callable<Boolean> tick = scheduler::onTimerTick;
        Future<Boolean> inFlight = background.submit(tick);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.toggleAutoRefresh();
        release.countDown();

        assertThat(inFlight.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.getLatestSnapshot()).isPresent();
        assertThat(scheduler.onTimerTick()).isFalse();
        verify(manager, times(1)).collect();
    }

    @Test
    void failedCycle_keepsLastKnownGoodSnapshot() {
        SystemSnapshot good = TestSnapshots.snapshot(T1);
        CollectionResult failure = CollectionResult.failure(Category.PROCESS, "listing failed", T1.plusSeconds(5));
        when(manager.collect())
                .thenReturn(CollectionResult.success(good))
                .thenReturn(failure);

        scheduler.onTimerTick();
        assertThat(scheduler.onTimerTick()).isTrue();

        assertThat(scheduler.getLatestSnapshot()).contains(good);
        assertThat(scheduler.getLastResult()).contains(failure);
        RefreshStatus status = scheduler.getStatus();
        assertThat(status.completedCycles()).isEqualTo(1);
        assertThat(status.failedCycles()).isEqualTo(1);
        assertThat(status.lastError().category()).isEqualTo(Category.PROCESS);
        assertThat(status.lastSnapshotAt()).isEqualTo(T1);
        verify(broadcaster).publish(failure);
    }

    @Test
    void unexpectedManagerException_isReportedAsFailure() {
        when(manager.collect()).thenThrow(new IllegalStateException("assembler broke"));

        Optional<CollectionResult> result = scheduler.triggerManualRefresh();

        assertThat(result).isPresent();
        assertThat(result.get().isSuccess()).isFalse();
        assertThat(result.get().error().message()).contains("assembler broke");
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.IDLE);
    }

    @Test
    void timerTick_publisherThrows_doesNotPropagate() {
        when(manager.collect()).thenReturn(CollectionResult.success(TestSnapshots.snapshot(T1)));
        doThrow(new RuntimeException("broker down")).when(broadcaster).publish(any());

        assertThatCode(() -> scheduler.onTimerTick()).doesNotThrowAnyException();
        assertThat(scheduler.getLatestSnapshot()).isPresent();
    }

    @Test
    void constructor_nonPositiveInterval_throws() {
        assertThatThrownBy(() -> new RefreshScheduler(manager, broadcaster, clock, 0, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void start_thenShutdown_runsInitialCycle() throws Exception {
        CountDownLatch collected = new CountDownLatch(1);
        when(manager.collect()).thenAnswer(inv -> {
            collected.countDown();
            return CollectionResult.success(TestSnapshots.snapshot(T1));
        });

        scheduler.start();
        try {
            assertThat(collected.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            scheduler.shutdown();
        }
    }
}
