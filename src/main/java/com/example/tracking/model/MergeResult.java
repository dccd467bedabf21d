package com.example.tracking.model;

/**
 * Outcome of applying a status + events payload to one package.
 *
 * {@code statusGuarded} is true when the incoming status was ignored because the
 * package had already reached a terminal state.
 */
public record MergeResult(
    String trackingNumber,
    PackageStatus previousStatus,
    PackageStatus status,
    int insertedEvents,
    int duplicateEvents,
    boolean statusGuarded
) {}
