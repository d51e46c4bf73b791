package com.hostwatch.dto;

/**
 * Frequencies in MHz. {@code min} is 0 when the platform does not expose it.
 */
public record CpuFrequency(
    double current,
    double min,
    double max
) {}
