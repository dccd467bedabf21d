package com.example.tracking.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * Push notification body sent by the carrier aggregation API.
 */
public record WebhookPayload(
    @JsonAlias({"tracking_number", "number"}) String trackingNumber,
    String status,
    List<TrackingEvent> events
) {}
