package com.example.tracking.model;

import java.util.List;

/**
 * Per-batch import outcome. Records listed in {@code errors} were not imported.
 */
public record ImportResult(
    int imported,
    int skipped,
    List<ImportFailure> errors
) {
    public enum Reason { DUPLICATE, INVALID }

    /**
     * @param index zero-based position of the record in the batch
     */
    public record ImportFailure(int index, String trackingNumber, Reason reason, String message) {}
}
