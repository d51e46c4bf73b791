package com.hostwatch.collector;

import com.hostwatch.dto.CpuData;
import com.hostwatch.dto.CpuFrequency;
import com.hostwatch.dto.DiskInfo;
import com.hostwatch.dto.HardwareData;
import com.hostwatch.dto.MemoryData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.software.os.OSFileStore;
import oshi.software.os.OperatingSystem;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads CPU, memory and disk usage. CPU usage is sampled over {@code cpuSampleMillis},
 * so every call blocks for at least that long.
 */
@Component
public class HardwareCollector {

    private static final Logger log = LoggerFactory.getLogger(HardwareCollector.class);
    private static final double HZ_PER_MHZ = 1_000_000.0;

    private final OperatingSystem os;
    private final HardwareAbstractionLayer hardware;
    private final long cpuSampleMillis;

    public HardwareCollector(
            OperatingSystem os,
            HardwareAbstractionLayer hardware,
            @Value("${hostwatch.collector.cpu-sample-millis:1000}") long cpuSampleMillis) {
        if (cpuSampleMillis < 0) {
            throw new IllegalArgumentException("hostwatch.collector.cpu-sample-millis must not be negative");
        }
        this.os = os;
        this.hardware = hardware;
        this.cpuSampleMillis = cpuSampleMillis;
    }

    public HardwareData collect() throws CollectorException {
        try {
            return new HardwareData(readCpu(), readMemory(), readDisks());
        } catch (RuntimeException e) {
            throw new CollectorException(Category.HARDWARE, "Hardware query failed: " + e.getMessage(), e);
        }
    }

    private CpuData readCpu() {
        CentralProcessor processor = hardware.getProcessor();
        double load = processor.getSystemCpuLoad(cpuSampleMillis);
        return new CpuData(
            processor.getPhysicalProcessorCount(),
            processor.getLogicalProcessorCount(),
            readFrequency(processor),
            Percentages.round1(Math.max(0.0, load) * 100.0)
        );
    }

    /**
     * Null when the platform reports no frequency at all or the query fails.
     */
    CpuFrequency readFrequency(CentralProcessor processor) {
        try {
            long max = processor.getMaxFreq();
            long[] perCore = processor.getCurrentFreq();
            double current = 0.0;
            int reported = 0;
            if (perCore != null) {
                for (long freq : perCore) {
                    if (freq > 0) {
                        current += freq;
                        reported++;
                    }
                }
            }
            if (max <= 0 && reported == 0) {
                return null;
            }
            double currentMhz = reported > 0 ? current / reported / HZ_PER_MHZ : max / HZ_PER_MHZ;
            double maxMhz = max > 0 ? max / HZ_PER_MHZ : currentMhz;
            return new CpuFrequency(currentMhz, 0.0, maxMhz);
        } catch (RuntimeException e) {
            log.debug("CPU frequency unavailable: {}", e.getMessage());
            return null;
        }
    }

    private MemoryData readMemory() {
        GlobalMemory memory = hardware.getMemory();
        long total = memory.getTotal();
        long available = memory.getAvailable();
        long used = total - available;
        return new MemoryData(total, available, used, Percentages.of(used, total));
    }

    private Map<String, DiskInfo> readDisks() {
        List<OSFileStore> stores = os.getFileSystem().getFileStores();
        Map<String, DiskInfo> disks = new LinkedHashMap<>();
        for (OSFileStore store : stores) {
            try {
                String device = store.getVolume();
                if (device == null || device.isBlank()) {
                    device = store.getName();
                }
                long total = store.getTotalSpace();
                if (total <= 0) {
                    log.debug("Skipping disk {} with no readable size", device);
                    continue;
                }
                long free = store.getUsableSpace();
                long used = total - store.getFreeSpace();
                disks.put(device, new DiskInfo(
                    store.getMount(),
                    store.getType(),
                    total,
                    used,
                    free,
                    Percentages.of(used, used + free)
                ));
            } catch (RuntimeException e) {
                log.debug("Skipping unreadable disk: {}", e.getMessage());
            }
        }
        return disks;
    }
}
