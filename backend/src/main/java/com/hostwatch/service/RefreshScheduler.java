package com.hostwatch.service;

import com.hostwatch.dto.CollectionError;
import com.hostwatch.dto.CollectionResult;
import com.hostwatch.dto.RefreshStatus;
import com.hostwatch.dto.SchedulerState;
import com.hostwatch.dto.SystemSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides when collection cycles run. Timer ticks run a cycle only while auto-refresh is
 * enabled; manual refreshes always run. At most one cycle is in flight: a trigger that
 * arrives while one is running is dropped, never queued.
 */
@Service
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final SnapshotManager manager;
    private final SnapshotBroadcaster broadcaster;
    private final Clock clock;
    private final long intervalSeconds;

    private final AtomicBoolean collecting = new AtomicBoolean(false);
    private final AtomicBoolean autoRefresh;
    private final AtomicLong completedCycles = new AtomicLong(0);
    private final AtomicLong failedCycles = new AtomicLong(0);
    private final AtomicLong droppedTriggers = new AtomicLong(0);

    private volatile SystemSnapshot latestSnapshot;
    private volatile CollectionResult lastResult;
    private volatile CollectionError lastError;
    private volatile ScheduledExecutorService timer;

    public RefreshScheduler(
            SnapshotManager manager,
            SnapshotBroadcaster broadcaster,
            Clock clock,
            @Value("${hostwatch.refresh.interval-seconds:5}") long intervalSeconds,
            @Value("${hostwatch.refresh.auto-refresh-enabled:true}") boolean autoRefreshEnabled) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("hostwatch.refresh.interval-seconds must be positive");
        }
        this.manager = manager;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.intervalSeconds = intervalSeconds;
        this.autoRefresh = new AtomicBoolean(autoRefreshEnabled);
    }

    @PostConstruct
    public synchronized void start() {
        if (timer != null && !timer.isShutdown()) {
            log.warn("Refresh timer already running");
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hostwatch-refresh");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleAtFixedRate(this::onTimerTick, 0, intervalSeconds, TimeUnit.SECONDS);
        log.info("Started refresh timer with interval {}s (auto-refresh {})",
            intervalSeconds, autoRefresh.get() ? "enabled" : "disabled");
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (timer == null) return;
        timer.shutdown();
        try {
            // an in-flight cycle is not interrupted
            if (!timer.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Collection cycle still running at shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        timer = null;
        log.info("Stopped refresh timer");
    }

    /**
     * Timer entry point. Returns true when a cycle ran.
     */
    public boolean onTimerTick() {
        try {
            if (!autoRefresh.get()) {
                return false;
            }
            return runCycle("timer").isPresent();
        } catch (Exception e) {
            // keeps the fixed-rate task alive
            log.error("Refresh tick failed", e);
            return false;
        }
    }

    /**
     * Runs a cycle regardless of the auto-refresh flag.
     *
     * @return the cycle's result, or empty when a cycle was already in flight
     */
    public Optional<CollectionResult> triggerManualRefresh() {
        return runCycle("manual");
    }

    /**
     * Flips auto-refresh. Never starts or stops a cycle.
     *
     * @return the new value
     */
    public boolean toggleAutoRefresh() {
        boolean previous;
        do {
            previous = autoRefresh.get();
        } while (!autoRefresh.compareAndSet(previous, !previous));
        boolean enabled = !previous;
        log.info("Auto-refresh {}", enabled ? "enabled" : "disabled");
        try {
            broadcaster.publishStatus(getStatus());
        } catch (RuntimeException e) {
            log.warn("Failed to publish refresh status", e);
        }
        return enabled;
    }

    public boolean isAutoRefreshEnabled() {
        return autoRefresh.get();
    }

    public SchedulerState getState() {
        return collecting.get() ? SchedulerState.COLLECTING : SchedulerState.IDLE;
    }

    /** Last successfully collected snapshot; failed cycles leave it unchanged. */
    public Optional<SystemSnapshot> getLatestSnapshot() {
        return Optional.ofNullable(latestSnapshot);
    }

    public Optional<CollectionResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    public RefreshStatus getStatus() {
        SystemSnapshot snapshot = latestSnapshot;
        return new RefreshStatus(
            getState(),
            autoRefresh.get(),
            intervalSeconds,
            completedCycles.get(),
            failedCycles.get(),
            droppedTriggers.get(),
            snapshot != null ? snapshot.timestamp() : null,
            lastError
        );
    }

    private Optional<CollectionResult> runCycle(String trigger) {
        if (!collecting.compareAndSet(false, true)) {
            droppedTriggers.incrementAndGet();
            log.debug("Dropped {} refresh, a cycle is already in flight", trigger);
            return Optional.empty();
        }

        CollectionResult result;
        try {
            result = collectSafely();
            record(result);
        } finally {
            collecting.set(false);
        }

        if (!result.isSuccess()) {
            log.warn("Refresh ({}) failed, keeping previous snapshot: {}", trigger, result.error().message());
        }
        try {
            broadcaster.publish(result);
        } catch (RuntimeException e) {
            log.warn("Failed to publish collection result", e);
        }
        return Optional.of(result);
    }

    private CollectionResult collectSafely() {
        try {
            return manager.collect();
        } catch (RuntimeException e) {
            log.error("Unexpected failure during collection cycle", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return CollectionResult.failure(null, "Unexpected collection failure: " + message, clock.instant());
        }
    }

    private void record(CollectionResult result) {
        lastResult = result;
        if (result.isSuccess()) {
            latestSnapshot = result.snapshot();
            completedCycles.incrementAndGet();
        } else {
            lastError = result.error();
            failedCycles.incrementAndGet();
        }
    }
}
