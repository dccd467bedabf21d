package com.example.tracking.service.sync;

import com.example.tracking.client.CarrierApiClient;
import com.example.tracking.config.TrackingMetrics;
import com.example.tracking.model.CarrierTrackingInfo;
import com.example.tracking.model.SyncResult;
import com.example.tracking.model.SyncResult.SyncFailure;
import com.example.tracking.service.CarrierDecodeException;
import com.example.tracking.service.CarrierTransportException;
import com.example.tracking.service.PackageNotFoundException;
import com.example.tracking.service.PackageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pull-based reconciliation of the local store against the carrier API.
 *
 * ALGORITHM:
 * 1. Collect target tracking numbers (one, or every tracked package)
 * 2. Query the carrier for all of them; every request must succeed before anything is merged
 * 3. Merge each requested number the carrier reported; omitted numbers are left untouched,
 *    numbers that were not requested are ignored
 * 4. Per-number merge failures are collected, not fatal
 *
 * A transport or decode failure aborts the run with zero store mutation.
 */
@Service
@Slf4j
public class ReconciliationService {

    private final PackageService packageService;
    private final CarrierApiClient carrierApiClient;
    private final TrackingMetrics metrics;

    /**
     * Maximum numbers per carrier request. Larger target sets are split.
     */
    private final int maxBatchSize;

    public ReconciliationService(
            PackageService packageService,
            CarrierApiClient carrierApiClient,
            TrackingMetrics metrics,
            @Value("${app.carrier.max-batch-size:40}") int maxBatchSize) {
        this.packageService = packageService;
        this.carrierApiClient = carrierApiClient;
        this.metrics = metrics;
        this.maxBatchSize = Math.max(1, maxBatchSize);
    }

    /**
     * Reconcile every tracked package.
     */
    public SyncResult syncAll() {
        return sync(null);
    }

    /**
     * Reconcile one package, or all packages when {@code trackingNumber} is null.
     *
     * @throws PackageNotFoundException if a specific number is given and not tracked
     * @throws CarrierTransportException if the carrier API cannot be reached
     * @throws CarrierDecodeException if the carrier response is malformed
     */
    public SyncResult sync(String trackingNumber) {
        List<String> targets = collectTargets(trackingNumber);
        if (targets.isEmpty()) {
            log.info("Sync requested with no tracked packages");
            return SyncResult.empty();
        }

        metrics.incrementSyncRuns();
        long startTime = System.currentTimeMillis();
        log.info("SYNC START: {} packages", targets.size());

        Map<String, CarrierTrackingInfo> reported;
        try {
            reported = fetch(targets);
        } catch (CarrierTransportException | CarrierDecodeException e) {
            metrics.incrementSyncFailedRuns();
            log.error("SYNC ABORTED: carrier query failed, store untouched: {}", e.getMessage());
            throw e;
        }

        Set<String> requested = new HashSet<>(targets);
        reported.keySet().stream()
                .filter(n -> !requested.contains(n))
                .forEach(n -> log.warn("Carrier reported {} which was not requested; ignored", n));

        int synced = 0;
        List<String> unreported = new ArrayList<>();
        List<SyncFailure> failures = new ArrayList<>();
        for (String number : targets) {
            CarrierTrackingInfo info = reported.get(number);
            if (info == null) {
                unreported.add(number);
                continue;
            }
            try {
                packageService.mergeUpdate(number, info.status(), info.events());
                synced++;
            } catch (PackageNotFoundException e) {
                log.warn("Package {} was removed during sync", number);
                failures.add(new SyncFailure(number, e.getMessage()));
            } catch (DataAccessException | TransactionException e) {
                log.error("Failed to merge {}: {}", number, e.getMessage(), e);
                failures.add(new SyncFailure(number, e.getMessage()));
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordSyncTime(duration);
        metrics.recordSyncOutcome(synced, failures.size(), unreported.size());
        log.info("SYNC COMPLETE in {}ms | synced: {} | unreported: {} | failures: {}",
                duration, synced, unreported.size(), failures.size());

        return new SyncResult(targets.size(), synced, unreported, failures);
    }

    private List<String> collectTargets(String trackingNumber) {
        if (trackingNumber == null) {
            return packageService.trackingNumbers();
        }
        String number = PackageService.requireTrackingNumber(trackingNumber);
        if (!packageService.isTracked(number)) {
            throw new PackageNotFoundException(number);
        }
        return List.of(number);
    }

    /**
     * Query all targets, chunked by {@link #maxBatchSize}. All chunks are fetched before
     * the caller merges anything.
     */
    private Map<String, CarrierTrackingInfo> fetch(List<String> targets) {
        Map<String, CarrierTrackingInfo> reported = new LinkedHashMap<>();
        List<List<String>> parts = partition(targets, maxBatchSize);
        int chunkNum = 1;
        for (List<String> chunk : parts) {
            if (parts.size() > 1) {
                log.info("Carrier query: chunk {}/{} ({} numbers)", chunkNum, parts.size(), chunk.size());
            }
            long start = System.currentTimeMillis();
            reported.putAll(carrierApiClient.query(chunk));
            metrics.recordCarrierFetchTime(System.currentTimeMillis() - start);
            chunkNum++;
        }
        return reported;
    }

    /**
     * Partition a list into chunks of specified size.
     */
    private static <T> List<List<T>> partition(List<T> list, int size) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            partitions.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return partitions;
    }
}
