package com.example.tracking.model;

import com.example.tracking.config.FlexibleInstantDeserializer;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Carrier-reported tracking event.
 *
 * The ledger of a package is a set keyed on (timestamp, description). Timestamps are
 * truncated to microseconds, the precision the store keeps, so keys compare equal
 * after a database round-trip.
 */
public record TrackingEvent(
    @JsonProperty("time") @JsonAlias({"timestamp", "event_time"})
    @JsonDeserialize(using = FlexibleInstantDeserializer.class) Instant timestamp,
    String location,
    String description
) {
    public TrackingEvent {
        if (timestamp != null) {
            timestamp = timestamp.truncatedTo(ChronoUnit.MICROS);
        }
    }

    @JsonIgnore
    public Key key() {
        return new Key(timestamp, description);
    }

    /**
     * Dedup key of an event within one package's ledger.
     */
    public record Key(Instant timestamp, String description) {}
}
