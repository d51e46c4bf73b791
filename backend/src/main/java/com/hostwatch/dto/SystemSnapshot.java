package com.hostwatch.dto;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable capture of every telemetry category, taken in a single collection cycle.
 */
public record SystemSnapshot(
    Instant timestamp,
    PlatformData platform,
    NetworkData network,
    HardwareData hardware,
    ProcessData process
) {
    public SystemSnapshot {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(hardware, "hardware");
        Objects.requireNonNull(process, "process");
    }
}
