package com.hostwatch.dto;

import java.time.Instant;

public record RefreshStatus(
    SchedulerState state,
    boolean autoRefreshEnabled,
    long intervalSeconds,
    long completedCycles,
    long failedCycles,
    long droppedTriggers,
    Instant lastSnapshotAt,
    CollectionError lastError
) {}
