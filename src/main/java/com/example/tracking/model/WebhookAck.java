package com.example.tracking.model;

/**
 * Acknowledgement returned for every accepted webhook call.
 */
public record WebhookAck(boolean success, String trackingNumber) {

    public static WebhookAck received(String trackingNumber) {
        return new WebhookAck(true, trackingNumber);
    }
}
