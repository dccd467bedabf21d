package com.example.tracking.model;

import java.time.Instant;

/**
 * Package row from the store. {@code trackingNumber} is the natural key used by
 * every external caller; {@code id} is store-assigned.
 */
public record TrackedPackage(
    long id,
    String trackingNumber,
    String carrier,
    PackageStatus status,
    Instant lastUpdate,   // null until the first sync or webhook
    Instant createdAt
) {}
