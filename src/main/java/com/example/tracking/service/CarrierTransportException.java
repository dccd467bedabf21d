package com.example.tracking.service;

/**
 * The carrier API could not be reached, timed out, or answered with a non-2xx status.
 */
public class CarrierTransportException extends TrackingException {

    public CarrierTransportException(String message) {
        super(message);
    }

    public CarrierTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
