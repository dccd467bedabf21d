package com.example.tracking.service.webhook;

import com.example.tracking.config.JacksonConfig;
import com.example.tracking.model.PackageDetails;
import com.example.tracking.model.PackageStatus;
import com.example.tracking.model.WebhookAck;
import com.example.tracking.model.WebhookPayload;
import com.example.tracking.service.PackageService;
import com.example.tracking.support.TestStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebhookServiceTest {

    private TestStore store;
    private PackageService packageService;
    private WebhookService service;

    @BeforeEach
    void setUp() {
        store = TestStore.create();
        packageService = store.packageService;
        ObjectMapper mapper = JacksonConfig.configure(new ObjectMapper());
        service = new WebhookService(packageService, mapper, store.metrics);
    }

    @Test
    @DisplayName("Webhook for a tracked number merges status and events")
    void trackedNumber_isMerged() {
        packageService.add("1Z999AA1", "ups");

        WebhookAck ack = service.handle("""
                {"trackingNumber":"1Z999AA1","status":"out_for_delivery",
                 "events":[{"time":"2024-05-03 08:00:00","location":"Austin","description":"Out for delivery"}]}
                """);

        assertThat(ack.success()).isTrue();
        assertThat(ack.trackingNumber()).isEqualTo("1Z999AA1");
        PackageDetails details = packageService.get("1Z999AA1");
        assertThat(details.trackedPackage().status()).isEqualTo(PackageStatus.OUT_FOR_DELIVERY);
        assertThat(details.events()).singleElement()
                .satisfies(e -> assertThat(e.timestamp()).isEqualTo(Instant.parse("2024-05-03T08:00:00Z")));
        assertThat(store.metrics.getWebhookAppliedCounter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Repeated delivery of the same webhook is a no-op")
    void repeatedWebhook_isIdempotent() {
        packageService.add("1Z999AA1", null);
        String body = """
                {"tracking_number":"1Z999AA1","status":"in_transit",
                 "events":[{"timestamp":"2024-05-02T09:30:00Z","description":"Arrived"}]}
                """;

        service.handle(body);
        service.handle(body);

        assertThat(packageService.get("1Z999AA1").events()).hasSize(1);
    }

    @Test
    @DisplayName("Webhook for an untracked number is acknowledged and creates nothing")
    void untrackedNumber_isAcknowledgedWithoutEffect() {
        WebhookAck ack = service.handle(new WebhookPayload("GHOST", "delivered", List.of()));

        assertThat(ack).isEqualTo(WebhookAck.received("GHOST"));
        assertThat(packageService.isTracked("GHOST")).isFalse();
        assertThat(packageService.list(null)).isEmpty();
        assertThat(store.metrics.getWebhookIgnoredCounter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Malformed bodies are acknowledged and counted as rejected")
    void malformedBody_isAcknowledged() {
        assertThat(service.handle("{not json").success()).isTrue();
        assertThat(service.handle("").success()).isTrue();
        assertThat(service.handle((String) null).success()).isTrue();

        assertThat(store.metrics.getWebhookRejectedCounter().count()).isEqualTo(3.0);
        assertThat(store.metrics.getWebhookReceivedCounter().count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("A payload without status is rejected but still acknowledged")
    void missingStatus_isRejected() {
        packageService.add("1Z999AA1", null);

        WebhookAck ack = service.handle(new WebhookPayload("1Z999AA1", null, List.of()));

        assertThat(ack.success()).isTrue();
        assertThat(packageService.get("1Z999AA1").trackedPackage().lastUpdate()).isNull();
        assertThat(store.metrics.getWebhookRejectedCounter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A webhook cannot move a delivered package back in transit")
    void deliveredPackage_isGuarded() {
        packageService.add("1Z999AA1", null);
        packageService.mergeUpdate("1Z999AA1", PackageStatus.DELIVERED, List.of());

        service.handle(new WebhookPayload("1Z999AA1", "in_transit", List.of()));

        assertThat(packageService.get("1Z999AA1").trackedPackage().status()).isEqualTo(PackageStatus.DELIVERED);
        assertThat(store.metrics.getStatusGuardedCounter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A store that cannot open a transaction is still acknowledged")
    void storeUnavailable_isAcknowledged() {
        packageService.add("1Z1", null);
        PlatformTransactionManager brokenTx = mock(PlatformTransactionManager.class);
        when(brokenTx.getTransaction(any())).thenThrow(new CannotCreateTransactionException("db down"));
        PackageService brokenStore = new PackageService(store.repository, store.locks, brokenTx, store.metrics);
        WebhookService webhooks = new WebhookService(brokenStore, JacksonConfig.configure(new ObjectMapper()), store.metrics);

        WebhookAck ack = webhooks.handle("{\"trackingNumber\":\"1Z1\",\"status\":\"in_transit\"}");

        assertThat(ack).isEqualTo(WebhookAck.received("1Z1"));
        assertThat(store.metrics.getWebhookRejectedCounter().count()).isEqualTo(1.0);
        assertThat(packageService.get("1Z1").trackedPackage().status()).isEqualTo(PackageStatus.PENDING);
    }

    @Test
    @DisplayName("An unrecognised carrier status is stored as unknown")
    void unknownStatus_mapsToUnknown() {
        packageService.add("1Z999AA1", null);

        service.handle(new WebhookPayload("1Z999AA1", "held_at_customs", List.of()));

        assertThat(packageService.get("1Z999AA1").trackedPackage().status()).isEqualTo(PackageStatus.UNKNOWN);
    }
}
