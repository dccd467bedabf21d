package com.example.tracking.service.webhook;

import com.example.tracking.config.TrackingMetrics;
import com.example.tracking.model.MergeResult;
import com.example.tracking.model.PackageStatus;
import com.example.tracking.model.WebhookAck;
import com.example.tracking.model.WebhookPayload;
import com.example.tracking.service.PackageNotFoundException;
import com.example.tracking.service.PackageService;
import com.example.tracking.service.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Applies carrier push notifications with the same merge as sync.
 *
 * Every call is acknowledged with success, whatever happened. A caller can not
 * tell tracked from untracked numbers, or a bad payload from a good one. Outcomes
 * are visible only in logs and metrics.
 *
 * A webhook for an untracked number never creates a package: the number-to-carrier
 * association comes only from an explicit add or import.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookService {

    private final PackageService packageService;
    private final ObjectMapper objectMapper;
    private final TrackingMetrics metrics;

    /**
     * Parse and apply a raw JSON body.
     */
    public WebhookAck handle(String body) {
        metrics.incrementWebhookReceived();
        WebhookPayload payload;
        try {
            payload = parse(body);
        } catch (ValidationException e) {
            metrics.incrementWebhookRejected();
            log.warn("Rejected webhook payload: {}", e.getMessage());
            return WebhookAck.received(null);
        }
        return apply(payload);
    }

    /**
     * Apply an already decoded payload.
     */
    public WebhookAck handle(WebhookPayload payload) {
        metrics.incrementWebhookReceived();
        return apply(payload);
    }

    private WebhookAck apply(WebhookPayload payload) {
        String reported = payload == null ? null : payload.trackingNumber();
        try {
            validate(payload);
            String number = PackageService.requireTrackingNumber(reported);
            PackageStatus status = PackageStatus.fromCode(payload.status());

            MergeResult result = packageService.mergeUpdate(number, status, payload.events());
            metrics.incrementWebhookApplied();
            log.info("Webhook applied to {}: status {} -> {}, {} new events",
                    number, result.previousStatus().code(), result.status().code(), result.insertedEvents());
        } catch (PackageNotFoundException e) {
            metrics.incrementWebhookIgnored();
            log.info("Webhook for untracked number {} acknowledged without effect", reported);
        } catch (ValidationException e) {
            metrics.incrementWebhookRejected();
            log.warn("Rejected webhook for {}: {}", reported, e.getMessage());
        } catch (DataAccessException | TransactionException e) {
            metrics.incrementWebhookRejected();
            log.error("Failed to apply webhook for {}: {}", reported, e.getMessage(), e);
        }
        return WebhookAck.received(reported);
    }

    private WebhookPayload parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ValidationException("Empty webhook body");
        }
        try {
            return objectMapper.readValue(body, WebhookPayload.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed webhook body: " + e.getOriginalMessage(), e);
        }
    }

    private static void validate(WebhookPayload payload) {
        if (payload == null) {
            throw new ValidationException("Missing webhook payload");
        }
        if (payload.trackingNumber() == null || payload.trackingNumber().isBlank()) {
            throw new ValidationException("Webhook payload has no tracking number");
        }
        if (payload.status() == null || payload.status().isBlank()) {
            throw new ValidationException("Webhook payload has no status");
        }
    }
}
