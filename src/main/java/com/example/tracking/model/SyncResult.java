package com.example.tracking.model;

import java.util.List;

/**
 * Result of one reconciliation run.
 *
 * {@code unreported} lists tracked numbers the carrier left out of its response; they
 * are not touched. {@code failures} lists numbers whose merge failed.
 */
public record SyncResult(
    int requested,
    int synced,
    List<String> unreported,
    List<SyncFailure> failures
) {
    public static SyncResult empty() {
        return new SyncResult(0, 0, List.of(), List.of());
    }

    public boolean success() {
        return failures.isEmpty();
    }

    /**
     * A tracking number that could not be merged.
     */
    public record SyncFailure(String trackingNumber, String error) {}
}
