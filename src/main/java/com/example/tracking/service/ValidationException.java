package com.example.tracking.service;

/**
 * Malformed input: an import record or file, a webhook payload, or an API argument.
 */
public class ValidationException extends TrackingException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
