package com.hostwatch.controller;

import com.hostwatch.dto.ManualRefreshResponse;
import com.hostwatch.dto.RefreshStatus;
import com.hostwatch.service.RefreshScheduler;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/refresh")
public class RefreshController {

    private final RefreshScheduler scheduler;

    public RefreshController(RefreshScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    public RefreshStatus status() {
        return scheduler.getStatus();
    }

    @PostMapping
    public ManualRefreshResponse refresh() {
        return scheduler.triggerManualRefresh()
                .map(result -> new ManualRefreshResponse(true, result))
                .orElseGet(() -> new ManualRefreshResponse(false, null));
    }

    @PostMapping("/toggle")
    public RefreshStatus toggle() {
        scheduler.toggleAutoRefresh();
        return scheduler.getStatus();
    }
}
