package com.hostwatch.dto;

/**
 * CPU counts and load. {@code maxFrequency} is null when the platform cannot report it.
 */
public record CpuData(
    int physicalCores,
    int totalCores,
    CpuFrequency maxFrequency,
    double currentUsage
) {}
