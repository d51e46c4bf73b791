package com.hostwatch.dto;

public record MemoryData(
    long total,
    long available,
    long used,
    double percent
) {}
