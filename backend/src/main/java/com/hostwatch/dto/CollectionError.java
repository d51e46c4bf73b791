package com.hostwatch.dto;

import com.hostwatch.collector.Category;

import java.time.Instant;

public record CollectionError(
    Category category,
    String message,
    Instant timestamp
) {}
