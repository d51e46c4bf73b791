package com.hostwatch;

import com.hostwatch.dto.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class TestSnapshots {

    private TestSnapshots() {}

    public static PlatformData platform() {
        return new PlatformData("Linux", "6.1.0", "build 42", "amd64", "Intel64 Family 6",
                new PlatformData.Architecture("64bit", "ELF"), "17.0.10+7");
    }

    public static NetworkData network() {
        return new NetworkData("box", "10.0.0.5", "aa:bb:cc:dd:ee:ff", Map.of(
                "eth0", List.of(new NetworkAddress("10.0.0.5", "255.255.255.0", NetworkAddress.AF_INET))));
    }

    public static HardwareData hardware() {
        return new HardwareData(
                new CpuData(4, 8, new CpuFrequency(2400.0, 0.0, 3600.0), 42.0),
                new MemoryData(16_000_000_000L, 8_000_000_000L, 8_000_000_000L, 50.0),
                Map.of("/dev/sda1", new DiskInfo("/", "ext4", 100L, 55L, 45L, 55.0)));
    }

    public static ProcessData process() {
        return new ProcessData(1, List.of(new ProcessInfo(1, "init", "root", 0.5)));
    }

    public static SystemSnapshot snapshot(Instant timestamp) {
        return new SystemSnapshot(timestamp, platform(), network(), hardware(), process());
    }

    public static SystemSnapshot snapshot() {
        return snapshot(Instant.parse("2026-01-01T00:00:00Z"));
    }
}
