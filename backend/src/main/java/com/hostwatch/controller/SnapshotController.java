package com.hostwatch.controller;

import com.hostwatch.dto.ExportRequest;
import com.hostwatch.dto.ExportResponse;
import com.hostwatch.dto.ProcessInfo;
import com.hostwatch.dto.SystemSnapshot;
import com.hostwatch.service.RefreshScheduler;
import com.hostwatch.service.SnapshotExportService;
import com.hostwatch.service.SnapshotUnavailableException;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

@RestController
@RequestMapping("/api/snapshot")
public class SnapshotController {

    private static final int MAX_TOP_PROCESSES = 500;

    private final RefreshScheduler scheduler;
    private final SnapshotExportService exportService;

    public SnapshotController(RefreshScheduler scheduler, SnapshotExportService exportService) {
        this.scheduler = scheduler;
        this.exportService = exportService;
    }

    @GetMapping
    public SystemSnapshot latest() {
        return requireSnapshot();
    }

    @GetMapping("/processes/top")
    public List<ProcessInfo> topProcesses(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_TOP_PROCESSES) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_TOP_PROCESSES);
        }
        return requireSnapshot().process().runningProcesses().stream()
                .sorted(Comparator.comparingDouble(ProcessInfo::memoryPercent).reversed())
                .limit(limit)
                .toList();
    }

    @GetMapping("/export/json")
    public ResponseEntity<byte[]> exportJson() {
        byte[] json = exportService.toJson(requireSnapshot());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=" + SnapshotExportService.DEFAULT_FILE_NAME)
                .contentType(MediaType.APPLICATION_JSON)
                .body(json);
    }

    @PostMapping("/export")
    public ExportResponse exportToFile(@Valid @RequestBody ExportRequest request) throws IOException {
        SystemSnapshot snapshot = requireSnapshot();
        Path written = exportService.writeToFile(snapshot, request.fileName());
        return new ExportResponse(written.toString(), snapshot.timestamp());
    }

    private SystemSnapshot requireSnapshot() {
        return scheduler.getLatestSnapshot()
                .orElseThrow(() -> new SnapshotUnavailableException("No snapshot has been collected yet"));
    }
}
