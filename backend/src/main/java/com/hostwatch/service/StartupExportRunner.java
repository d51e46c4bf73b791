package com.hostwatch.service;

import com.hostwatch.dto.CollectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Collects one snapshot right after startup and saves it to a file.
 */
@Component
@ConditionalOnProperty(name = "hostwatch.export.on-startup", havingValue = "true")
public class StartupExportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupExportRunner.class);
    private static final int MAX_ATTEMPTS = 50;
    private static final long RETRY_DELAY_MS = 200;

    private final RefreshScheduler scheduler;
    private final SnapshotExportService exportService;
    private final String fileName;

    public StartupExportRunner(RefreshScheduler scheduler,
                               SnapshotExportService exportService,
                               @Value("${hostwatch.export.file-name:" + SnapshotExportService.DEFAULT_FILE_NAME + "}") String fileName) {
        this.scheduler = scheduler;
        this.exportService = exportService;
        this.fileName = fileName;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        Optional<CollectionResult> result = Optional.empty();
        // the timer may be mid-cycle at startup
        for (int attempt = 0; attempt < MAX_ATTEMPTS && result.isEmpty(); attempt++) {
            result = scheduler.triggerManualRefresh();
            if (result.isEmpty()) {
                Thread.sleep(RETRY_DELAY_MS);
            }
        }

        if (result.isEmpty()) {
            log.warn("Startup export skipped, collection stayed busy");
            return;
        }
        if (!result.get().isSuccess()) {
            log.warn("Startup export skipped, collection failed: {}", result.get().error().message());
            return;
        }
        exportService.writeToFile(result.get().snapshot(), fileName);
    }
}
