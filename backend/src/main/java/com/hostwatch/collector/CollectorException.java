package com.hostwatch.collector;

/**
 * Raised when a whole telemetry category cannot be read. Failures of single entries
 * (one disk, one process) never surface as this exception.
 */
public class CollectorException extends Exception {

    private final Category category;

    public CollectorException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public CollectorException(Category category, String message) {
        super(message);
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
