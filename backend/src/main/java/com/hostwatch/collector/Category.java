package com.hostwatch.collector;

/**
 * Telemetry domains, in the order a collection cycle visits them.
 */
public enum Category {
    PLATFORM,
    NETWORK,
    HARDWARE,
    PROCESS
}
