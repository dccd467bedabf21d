package com.example.tracking.service;

import lombok.Getter;

/**
 * Thrown when an operation names a tracking number the store does not hold.
 */
@Getter
public class PackageNotFoundException extends TrackingException {

    private final String trackingNumber;

    public PackageNotFoundException(String trackingNumber) {
        super("Package not found: " + trackingNumber);
        this.trackingNumber = trackingNumber;
    }
}
