package com.example.tracking.service;

import com.example.tracking.config.TrackingMetrics;
import com.example.tracking.model.MergeResult;
import com.example.tracking.model.PackageDetails;
import com.example.tracking.model.PackageStatus;
import com.example.tracking.model.TrackedPackage;
import com.example.tracking.model.TrackingEvent;
import com.example.tracking.repository.PackageRepository;
import com.example.tracking.service.lock.PackageLockRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The package store: CRUD over packages and their event ledgers, plus the merge
 * used by both sync and webhook ingestion.
 *
 * MERGE RULES:
 * - status is last-writer-wins, except that a terminal status (delivered, exception)
 *   is only replaced by another terminal status
 * - an incoming event is appended only if the ledger has no event with the same
 *   (timestamp, description); applying the same payload twice is a no-op the second time
 *
 * CONCURRENCY:
 * - merge, delete and get hold the per-tracking-number lock and run in one transaction,
 *   so a reader never sees a half-applied merge and two merges never interleave
 */
@Service
@Slf4j
public class PackageService {

    /**
     * Column widths of packages.tracking_number and packages.carrier.
     */
    static final int MAX_TRACKING_NUMBER_LENGTH = 128;
    static final int MAX_CARRIER_LENGTH = 64;

    private final PackageRepository repository;
    private final PackageLockRegistry locks;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;
    private final TrackingMetrics metrics;

    public PackageService(
            PackageRepository repository,
            PackageLockRegistry locks,
            PlatformTransactionManager transactionManager,
            TrackingMetrics metrics) {
        this.repository = repository;
        this.locks = locks;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
        this.metrics = metrics;
    }

    /**
     * Start tracking a number. New packages are {@code pending} with an empty ledger.
     *
     * @throws DuplicatePackageException if the number is already tracked
     * @throws ValidationException if the number is blank or either value is too long
     */
    public TrackedPackage add(String trackingNumber, String carrier) {
        String number = requireTrackingNumber(trackingNumber);
        String carrierCode = carrier == null || carrier.isBlank() ? null : carrier.trim();
        if (carrierCode != null && carrierCode.length() > MAX_CARRIER_LENGTH) {
            throw new ValidationException("Carrier code exceeds " + MAX_CARRIER_LENGTH + " characters");
        }

        TrackedPackage created = repository.insert(number, carrierCode, PackageStatus.PENDING, Instant.now());
        metrics.incrementPackagesAdded();
        log.info("Added package {} (carrier={})", number, carrierCode);
        return created;
    }

    /**
     * All packages, most recently created first.
     *
     * @param statusFilter exact status to match, or null for all
     */
    public List<TrackedPackage> list(PackageStatus statusFilter) {
        return repository.findAll(statusFilter);
    }

    /**
     * A package and its ledger, newest event first.
     *
     * @throws PackageNotFoundException if the number is not tracked
     */
    public PackageDetails get(String trackingNumber) {
        String number = requireTrackingNumber(trackingNumber);
        return snapshot(number).orElseThrow(() -> new PackageNotFoundException(number));
    }

    /**
     * Consistent read of one package and its ledger, empty if the number is not tracked.
     */
    public Optional<PackageDetails> snapshot(String trackingNumber) {
        return locks.withLock(trackingNumber, () -> readTransaction.execute(status ->
                repository.findByTrackingNumber(trackingNumber)
                        .map(p -> new PackageDetails(p, repository.findEvents(p.id())))));
    }

    public boolean isTracked(String trackingNumber) {
        return repository.findByTrackingNumber(requireTrackingNumber(trackingNumber)).isPresent();
    }

    public List<String> trackingNumbers() {
        return repository.findAllTrackingNumbers();
    }

    /**
     * Remove a package together with its ledger.
     *
     * @throws PackageNotFoundException if the number is not tracked
     */
    public void delete(String trackingNumber) {
        String number = requireTrackingNumber(trackingNumber);
        locks.runWithLock(number, () -> writeTransaction.executeWithoutResult(status -> {
            TrackedPackage existing = repository.lockByTrackingNumber(number)
                    .orElseThrow(() -> new PackageNotFoundException(number));
            if (!repository.delete(existing.id())) {
                throw new PackageNotFoundException(number);
            }
        }));
        metrics.incrementPackagesDeleted();
        log.info("Deleted package {}", number);
    }

    /**
     * Apply a carrier status and events to a tracked package. Idempotent.
     *
     * @throws PackageNotFoundException if the number is not tracked
     */
    public MergeResult mergeUpdate(String trackingNumber, PackageStatus newStatus, List<TrackingEvent> events) {
        String number = requireTrackingNumber(trackingNumber);
        List<TrackingEvent> incoming = events == null ? List.of() : events;

        long start = System.currentTimeMillis();
        MergeResult result = locks.withLock(number, () ->
                writeTransaction.execute(status -> doMerge(number, newStatus, incoming)));
        metrics.recordMergeTime(System.currentTimeMillis() - start);
        metrics.recordMerge(result.insertedEvents(), result.duplicateEvents(), result.statusGuarded());

        if (result.statusGuarded()) {
            log.warn("Package {} is {}; ignoring reported status {}",
                    number, result.previousStatus().code(), newStatus.code());
        }
        log.debug("Merged package {}: {} -> {}, {} new events, {} duplicates",
                number, result.previousStatus().code(), result.status().code(),
                result.insertedEvents(), result.duplicateEvents());
        return result;
    }

    private MergeResult doMerge(String number, PackageStatus newStatus, List<TrackingEvent> incoming) {
        TrackedPackage current = repository.lockByTrackingNumber(number)
                .orElseThrow(() -> new PackageNotFoundException(number));

        PackageStatus resolved = current.status().mergeWith(newStatus);
        boolean guarded = newStatus != null && resolved != newStatus;

        Set<TrackingEvent.Key> known = repository.findEventKeys(current.id());
        List<TrackingEvent> fresh = new ArrayList<>();
        int duplicates = 0;
        for (TrackingEvent event : incoming) {
            if (event == null) {
                continue;
            }
            if (known.add(event.key())) {
                fresh.add(event);
            } else {
                duplicates++;
            }
        }

        repository.insertEvents(current.id(), fresh);
        repository.updateStatus(current.id(), resolved, Instant.now());

        return new MergeResult(number, current.status(), resolved,
                fresh.size(), duplicates, guarded);
    }

    /**
     * Trimmed tracking number.
     *
     * @throws ValidationException if null, blank or too long
     */
    public static String requireTrackingNumber(String trackingNumber) {
        if (trackingNumber == null || trackingNumber.isBlank()) {
            throw new ValidationException("Tracking number is required");
        }
        String number = trackingNumber.trim();
        if (number.length() > MAX_TRACKING_NUMBER_LENGTH) {
            throw new ValidationException("Tracking number exceeds " + MAX_TRACKING_NUMBER_LENGTH + " characters");
        }
        return number;
    }
}
