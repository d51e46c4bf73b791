package com.hostwatch.collector;

import com.hostwatch.dto.ProcessData;
import com.hostwatch.dto.ProcessInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists running processes. The total count and the detailed listing are two separate
 * queries and may disagree when processes come and go between them.
 */
@Component
public class ProcessCollector {

    private static final Logger log = LoggerFactory.getLogger(ProcessCollector.class);

    private final OperatingSystem os;
    private final HardwareAbstractionLayer hardware;

    public ProcessCollector(OperatingSystem os, HardwareAbstractionLayer hardware) {
        this.os = os;
        this.hardware = hardware;
    }

    public ProcessData collect() throws CollectorException {
        int total;
        List<OSProcess> processes;
        long totalMemory;
        try {
            total = os.getProcessCount();
            processes = os.getProcesses();
            totalMemory = hardware.getMemory().getTotal();
        } catch (RuntimeException e) {
            throw new CollectorException(Category.PROCESS, "Process listing failed: " + e.getMessage(), e);
        }

        List<ProcessInfo> running = new ArrayList<>(processes.size());
        int skipped = 0;
        for (OSProcess process : processes) {
            ProcessInfo info = describe(process, totalMemory);
            if (info != null) {
                running.add(info);
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.trace("Skipped {} processes that exited or could not be read", skipped);
        }
        return new ProcessData(total, running);
    }

    private static ProcessInfo describe(OSProcess process, long totalMemory) {
        try {
            OSProcess.State state = process.getState();
            if (state == OSProcess.State.ZOMBIE || state == OSProcess.State.INVALID) {
                return null;
            }
            double memoryPercent = totalMemory > 0
                ? process.getResidentSetSize() * 100.0 / totalMemory
                : 0.0;
            return new ProcessInfo(
                process.getProcessID(),
                process.getName(),
                process.getUser(),
                memoryPercent
            );
        } catch (RuntimeException e) {
            log.trace("Process entry unreadable: {}", e.getMessage());
            return null;
        }
    }
}
