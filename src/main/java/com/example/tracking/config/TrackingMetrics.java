package com.example.tracking.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Application metrics for the tracking store.
 *
 * View at: http://localhost:8080/actuator/metrics
 *
 * Key metrics:
 * - tracking.carrier.fetch   → Carrier API call timing (use MEAN for avg)
 * - tracking.merge.time      → Single package merge timing
 * - tracking.sync.runs       → Sync runs started
 * - tracking.sync.synced     → Packages merged by sync
 * - tracking.events.inserted → Ledger rows written
 * - tracking.events.duplicate→ Incoming events already in the ledger
 * - tracking.webhook.*       → Webhook outcomes
 */
@Component
@Getter
public class TrackingMetrics {

    // Timers (track count, total time, max, mean)
    private final Timer carrierFetchTimer;
    private final Timer mergeTimer;
    private final Timer syncTimer;

    // Counters
    private final Counter packagesAddedCounter;
    private final Counter packagesDeletedCounter;
    private final Counter syncRunsCounter;
    private final Counter syncFailedRunsCounter;
    private final Counter syncedPackagesCounter;
    private final Counter syncMergeFailuresCounter;
    private final Counter unreportedPackagesCounter;
    private final Counter eventsInsertedCounter;
    private final Counter eventsDuplicateCounter;
    private final Counter statusGuardedCounter;
    private final Counter webhookReceivedCounter;
    private final Counter webhookAppliedCounter;
    private final Counter webhookIgnoredCounter;
    private final Counter webhookRejectedCounter;
    private final Counter importedRecordsCounter;
    private final Counter importSkippedRecordsCounter;

    public TrackingMetrics(MeterRegistry registry) {
        // ═══════════════════════════════════════════════════════════════
        // TIMERS - Track latency (count, total, max, mean)
        // ═══════════════════════════════════════════════════════════════

        this.carrierFetchTimer = Timer.builder("tracking.carrier.fetch")
                .description("Carrier API batch query time")
                .register(registry);

        this.mergeTimer = Timer.builder("tracking.merge.time")
                .description("Time to merge status and events into one package")
                .register(registry);

        this.syncTimer = Timer.builder("tracking.sync.time")
                .description("End-to-end sync run time")
                .register(registry);

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS - Track counts
        // ═══════════════════════════════════════════════════════════════

        this.packagesAddedCounter = Counter.builder("tracking.packages.added")
                .description("Packages added (API and import)")
                .register(registry);

        this.packagesDeletedCounter = Counter.builder("tracking.packages.deleted")
                .description("Packages deleted")
                .register(registry);

        this.syncRunsCounter = Counter.builder("tracking.sync.runs")
                .description("Sync runs started")
                .register(registry);

        this.syncFailedRunsCounter = Counter.builder("tracking.sync.runs.failed")
                .description("Sync runs aborted by a carrier transport or decode failure")
                .register(registry);

        this.syncedPackagesCounter = Counter.builder("tracking.sync.synced")
                .description("Packages merged by sync")
                .register(registry);

        this.syncMergeFailuresCounter = Counter.builder("tracking.sync.merge.failed")
                .description("Per-package merge failures during sync")
                .register(registry);

        this.unreportedPackagesCounter = Counter.builder("tracking.sync.unreported")
                .description("Tracked packages missing from a carrier response")
                .register(registry);

        this.eventsInsertedCounter = Counter.builder("tracking.events.inserted")
                .description("Events appended to ledgers")
                .register(registry);

        this.eventsDuplicateCounter = Counter.builder("tracking.events.duplicate")
                .description("Incoming events already present in the ledger")
                .register(registry);

        this.statusGuardedCounter = Counter.builder("tracking.status.guarded")
                .description("Status updates ignored because the package was terminal")
                .register(registry);

        this.webhookReceivedCounter = Counter.builder("tracking.webhook.received")
                .description("Webhook calls received")
                .register(registry);

        this.webhookAppliedCounter = Counter.builder("tracking.webhook.applied")
                .description("Webhook calls merged into a tracked package")
                .register(registry);

        this.webhookIgnoredCounter = Counter.builder("tracking.webhook.ignored")
                .description("Webhook calls for untracked numbers")
                .register(registry);

        this.webhookRejectedCounter = Counter.builder("tracking.webhook.rejected")
                .description("Webhook calls that were malformed or failed to apply")
                .register(registry);

        this.importedRecordsCounter = Counter.builder("tracking.import.imported")
                .description("Import records stored")
                .register(registry);

        this.importSkippedRecordsCounter = Counter.builder("tracking.import.skipped")
                .description("Import records skipped as duplicate or invalid")
                .register(registry);
    }

    // ═══════════════════════════════════════════════════════════════
    // TIMING METHODS
    // ═══════════════════════════════════════════════════════════════

    public void recordCarrierFetchTime(long millis) {
        carrierFetchTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordMergeTime(long millis) {
        mergeTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordSyncTime(long millis) {
        syncTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    // ═══════════════════════════════════════════════════════════════
    // COUNTER METHODS
    // ═══════════════════════════════════════════════════════════════

    public void incrementPackagesAdded() {
        packagesAddedCounter.increment();
    }

    public void incrementPackagesDeleted() {
        packagesDeletedCounter.increment();
    }

    public void incrementSyncRuns() {
        syncRunsCounter.increment();
    }

    public void incrementSyncFailedRuns() {
        syncFailedRunsCounter.increment();
    }

    public void recordSyncOutcome(int synced, int failed, int unreported) {
        syncedPackagesCounter.increment(synced);
        syncMergeFailuresCounter.increment(failed);
        unreportedPackagesCounter.increment(unreported);
    }

    public void recordMerge(int inserted, int duplicates, boolean statusGuarded) {
        eventsInsertedCounter.increment(inserted);
        eventsDuplicateCounter.increment(duplicates);
        if (statusGuarded) {
            statusGuardedCounter.increment();
        }
    }

    public void incrementWebhookReceived() {
        webhookReceivedCounter.increment();
    }

    public void incrementWebhookApplied() {
        webhookAppliedCounter.increment();
    }

    public void incrementWebhookIgnored() {
        webhookIgnoredCounter.increment();
    }

    public void incrementWebhookRejected() {
        webhookRejectedCounter.increment();
    }

    public void recordImport(int imported, int skipped) {
        importedRecordsCounter.increment(imported);
        importSkippedRecordsCounter.increment(skipped);
    }
}
