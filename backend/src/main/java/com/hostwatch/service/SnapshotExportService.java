package com.hostwatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hostwatch.dto.SystemSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a snapshot as a flat JSON document with snake_case field names and an ISO-8601 timestamp.
 */
@Service
public class SnapshotExportService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotExportService.class);
    public static final String DEFAULT_FILE_NAME = "system_data.json";

    private final ObjectWriter writer;
    private final Path exportDirectory;

    public SnapshotExportService(ObjectMapper objectMapper,
                                 @Value("${hostwatch.export.directory:.}") String exportDirectory) {
        this.writer = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .writerWithDefaultPrettyPrinter();
        this.exportDirectory = Path.of(exportDirectory).toAbsolutePath().normalize();
    }

    public byte[] toJson(SystemSnapshot snapshot) {
        try {
            return writer.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize snapshot", e);
        }
    }

    /**
     * Writes the snapshot into the export directory, replacing any existing file.
     *
     * @throws SecurityException if the file name resolves outside the export directory
     */
    public Path writeToFile(SystemSnapshot snapshot, String fileName) throws IOException {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        Path target = exportDirectory.resolve(fileName).normalize();
        if (!target.startsWith(exportDirectory) || target.equals(exportDirectory)) {
            throw new SecurityException("Export path escapes export directory: " + fileName);
        }
        Files.createDirectories(target.getParent());
        Files.write(target, toJson(snapshot));
        log.info("Exported snapshot taken at {} to {}", snapshot.timestamp(), target);
        return target;
    }

    public Path getExportDirectory() {
        return exportDirectory;
    }
}
