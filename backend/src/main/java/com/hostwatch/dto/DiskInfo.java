package com.hostwatch.dto;

public record DiskInfo(
    String mountpoint,
    String filesystem,
    long total,
    long used,
    long free,
    double percent
) {}
