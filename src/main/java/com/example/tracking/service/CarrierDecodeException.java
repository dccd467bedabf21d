package com.example.tracking.service;

/**
 * The carrier API answered, but the body could not be decoded.
 */
public class CarrierDecodeException extends TrackingException {

    public CarrierDecodeException(String message) {
        super(message);
    }

    public CarrierDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
