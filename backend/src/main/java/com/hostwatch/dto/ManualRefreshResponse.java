package com.hostwatch.dto;

/**
 * {@code refreshed} is false when another cycle was already in flight; {@code result} is then null.
 */
public record ManualRefreshResponse(
    boolean refreshed,
    CollectionResult result
) {}
