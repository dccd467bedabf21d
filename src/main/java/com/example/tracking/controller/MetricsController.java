package com.example.tracking.controller;

import com.example.tracking.config.TrackingMetrics;
import com.example.tracking.service.lock.PackageLockRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST endpoint for a tracking metrics summary.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final TrackingMetrics metrics;
    private final PackageLockRegistry lockRegistry;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("packages", getPackageMetrics());
        response.put("sync", getSyncMetrics());
        response.put("webhook", getWebhookMetrics());
        response.put("locks", lockRegistry.getStats());

        return response;
    }

    @GetMapping("/sync")
    public Map<String, Object> getSyncMetrics() {
        Map<String, Object> sync = new LinkedHashMap<>();

        sync.put("runs", count(metrics.getSyncRunsCounter()));
        sync.put("failedRuns", count(metrics.getSyncFailedRunsCounter()));
        sync.put("synced", count(metrics.getSyncedPackagesCounter()));
        sync.put("mergeFailures", count(metrics.getSyncMergeFailuresCounter()));
        sync.put("unreported", count(metrics.getUnreportedPackagesCounter()));
        sync.put("carrierFetch", getTimerStats(metrics.getCarrierFetchTimer()));
        sync.put("run", getTimerStats(metrics.getSyncTimer()));

        return sync;
    }

    @GetMapping("/webhook")
    public Map<String, Object> getWebhookMetrics() {
        Map<String, Object> webhook = new LinkedHashMap<>();

        webhook.put("received", count(metrics.getWebhookReceivedCounter()));
        webhook.put("applied", count(metrics.getWebhookAppliedCounter()));
        webhook.put("ignored", count(metrics.getWebhookIgnoredCounter()));
        webhook.put("rejected", count(metrics.getWebhookRejectedCounter()));

        return webhook;
    }

    private Map<String, Object> getPackageMetrics() {
        Map<String, Object> packages = new LinkedHashMap<>();

        packages.put("added", count(metrics.getPackagesAddedCounter()));
        packages.put("deleted", count(metrics.getPackagesDeletedCounter()));
        packages.put("imported", count(metrics.getImportedRecordsCounter()));
        packages.put("importSkipped", count(metrics.getImportSkippedRecordsCounter()));
        packages.put("eventsInserted", count(metrics.getEventsInsertedCounter()));
        packages.put("eventsDuplicate", count(metrics.getEventsDuplicateCounter()));
        packages.put("statusGuarded", count(metrics.getStatusGuardedCounter()));
        packages.put("merge", getTimerStats(metrics.getMergeTimer()));

        return packages;
    }

    private static long count(Counter counter) {
        return (long) counter.count();
    }

    /**
     * Extract stats from a Timer.
     */
    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }

        return stats;
    }
}
