package com.example.tracking.model;

import java.time.Instant;

/**
 * Error body returned by the REST API.
 */
public record ErrorResponse(String error, String message, Instant timestamp) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, Instant.now());
    }
}
