package com.hostwatch.dto;

import java.time.Instant;

public record ExportResponse(
    String path,
    Instant snapshotTimestamp
) {}
