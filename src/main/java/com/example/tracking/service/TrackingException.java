package com.example.tracking.service;

/**
 * Base type for failures raised by the tracking store, sync and import paths.
 */
public abstract class TrackingException extends RuntimeException {

    protected TrackingException(String message) {
        super(message);
    }

    protected TrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
