package com.hostwatch.service;

import com.hostwatch.collector.Category;
import com.hostwatch.collector.CollectorException;
import com.hostwatch.collector.HardwareCollector;
import com.hostwatch.collector.NetworkCollector;
import com.hostwatch.collector.PlatformCollector;
import com.hostwatch.collector.ProcessCollector;
import com.hostwatch.dto.CollectionResult;
import com.hostwatch.dto.HardwareData;
import com.hostwatch.dto.NetworkData;
import com.hostwatch.dto.PlatformData;
import com.hostwatch.dto.ProcessData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs one collection cycle: platform, network, hardware, then process.
 * The first collector that fails ends the cycle; nothing is cached or retried.
 */
@Service
public class SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

    @FunctionalInterface
    private interface CollectorCall<T> {
        T call() throws CollectorException;
    }

    private final PlatformCollector platformCollector;
    private final NetworkCollector networkCollector;
    private final HardwareCollector hardwareCollector;
    private final ProcessCollector processCollector;
    private final SnapshotAssembler assembler;
    private final Clock clock;

    private Instant lastTimestamp;

    public SnapshotManager(PlatformCollector platformCollector,
                           NetworkCollector networkCollector,
                           HardwareCollector hardwareCollector,
                           ProcessCollector processCollector,
                           SnapshotAssembler assembler,
                           Clock clock) {
        this.platformCollector = platformCollector;
        this.networkCollector = networkCollector;
        this.hardwareCollector = hardwareCollector;
        this.processCollector = processCollector;
        this.assembler = assembler;
        this.clock = clock;
    }

    public CollectionResult collect() {
        Instant timestamp = nextTimestamp();
        long started = System.nanoTime();
        try {
            PlatformData platform = run(Category.PLATFORM, platformCollector::collect);
            NetworkData network = run(Category.NETWORK, networkCollector::collect);
            HardwareData hardware = run(Category.HARDWARE, hardwareCollector::collect);
            ProcessData process = run(Category.PROCESS, processCollector::collect);

            CollectionResult result = CollectionResult.success(
                assembler.assemble(timestamp, platform, network, hardware, process));
            log.debug("Collected snapshot as of {} in {}ms ({} processes, {} disks)",
                timestamp, (System.nanoTime() - started) / 1_000_000,
                process.runningProcesses().size(), hardware.disk().size());
            return result;
        } catch (CollectorException e) {
            log.warn("Collection cycle failed in {}: {}", e.getCategory(), e.getMessage());
            return CollectionResult.failure(e.getCategory(), e.getMessage(), timestamp);
        }
    }

    private static <T> T run(Category category, CollectorCall<T> call) throws CollectorException {
        try {
            T value = call.call();
            if (value == null) {
                throw new CollectorException(category, category + " collector returned no data");
            }
            return value;
        } catch (CollectorException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new CollectorException(category, "Unexpected " + category + " collector failure: " + message, e);
        }
    }

    /**
     * Wall-clock capture time, nudged forward when the clock has not advanced since the previous cycle.
     */
    private synchronized Instant nextTimestamp() {
        Instant now = clock.instant();
        if (lastTimestamp != null && !now.isAfter(lastTimestamp)) {
            now = lastTimestamp.plusNanos(1);
        }
        lastTimestamp = now;
        return now;
    }
}
