package com.example.tracking.model;

import java.util.List;

/**
 * Status and events the carrier API reports for one tracking number.
 */
public record CarrierTrackingInfo(
    PackageStatus status,
    List<TrackingEvent> events
) {
    public CarrierTrackingInfo {
        status = status != null ? status : PackageStatus.UNKNOWN;
        events = events != null ? List.copyOf(events) : List.of();
    }
}
