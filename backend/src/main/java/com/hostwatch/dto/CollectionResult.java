package com.hostwatch.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.hostwatch.collector.Category;

import java.time.Instant;

/**
 * Outcome of one collection cycle: a complete snapshot or the failure that prevented it.
 * Exactly one of {@code snapshot} and {@code error} is set.
 */
public record CollectionResult(
    SystemSnapshot snapshot,
    CollectionError error
) {
    public CollectionResult {
        if ((snapshot == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of snapshot or error must be set");
        }
    }

    public static CollectionResult success(SystemSnapshot snapshot) {
        return new CollectionResult(snapshot, null);
    }

    public static CollectionResult failure(Category category, String message, Instant timestamp) {
        return new CollectionResult(null, new CollectionError(category, message, timestamp));
    }

    @JsonIgnore
    public boolean isSuccess() {
        return snapshot != null;
    }
}
