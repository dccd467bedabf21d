package com.example.tracking.model;

import java.util.List;

/**
 * A package with its event ledger, newest event first.
 */
public record PackageDetails(
    TrackedPackage trackedPackage,
    List<TrackingEvent> events
) {}
