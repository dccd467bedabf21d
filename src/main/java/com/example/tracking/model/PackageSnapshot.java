package com.example.tracking.model;

import java.time.Instant;
import java.util.List;

/**
 * Export shape of one package and its ledger.
 */
public record PackageSnapshot(
    String trackingNumber,
    String carrier,
    PackageStatus status,
    Instant lastUpdate,
    Instant createdAt,
    List<TrackingEvent> events
) {
    public static PackageSnapshot of(PackageDetails details) {
        TrackedPackage p = details.trackedPackage();
        return new PackageSnapshot(p.trackingNumber(), p.carrier(), p.status(),
                p.lastUpdate(), p.createdAt(), details.events());
    }
}
