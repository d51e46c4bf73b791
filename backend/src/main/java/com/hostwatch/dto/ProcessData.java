package com.hostwatch.dto;

import java.util.List;

/**
 * {@code totalProcesses} is counted separately from the detailed listing, so the two can
 * disagree when processes start or exit in between.
 */
public record ProcessData(
    int totalProcesses,
    List<ProcessInfo> runningProcesses
) {
    public ProcessData {
        runningProcesses = runningProcesses == null ? List.of() : List.copyOf(runningProcesses);
    }
}
