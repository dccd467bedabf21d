package com.example.tracking.model;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * One record of an import file.
 */
public record ImportRecord(
    @JsonAlias({"tracking_number", "trackingNumber"}) String number,
    String carrier
) {}
