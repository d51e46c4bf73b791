package com.hostwatch.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record HardwareData(
    CpuData cpu,
    MemoryData memory,
    Map<String, DiskInfo> disk
) {
    public HardwareData {
        Objects.requireNonNull(cpu, "cpu");
        Objects.requireNonNull(memory, "memory");
        disk = disk == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(disk));
    }
}
