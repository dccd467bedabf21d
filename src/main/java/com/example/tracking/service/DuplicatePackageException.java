package com.example.tracking.service;

import lombok.Getter;

/**
 * Thrown when a tracking number is added that the store already tracks.
 */
@Getter
public class DuplicatePackageException extends TrackingException {

    private final String trackingNumber;

    public DuplicatePackageException(String trackingNumber) {
        super("Package already exists: " + trackingNumber);
        this.trackingNumber = trackingNumber;
    }
}
