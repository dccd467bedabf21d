package com.example.tracking.repository;

import com.example.tracking.model.PackageStatus;
import com.example.tracking.model.TrackedPackage;
import com.example.tracking.model.TrackingEvent;
import com.example.tracking.service.DuplicatePackageException;
import com.example.tracking.service.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * JDBC access to the packages and events tables.
 *
 * Methods here run in whatever transaction the caller holds; atomicity across
 * several statements is the service layer's concern. Plain reads outside a
 * transaction are retried on transient failures, writes never are.
 */
@Repository
@Slf4j
public class PackageRepository {

    private static final String GENERATED_ID_COLUMN = "ID";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;
    private final int maxRetries;
    private final long retryDelayMs;

    private final RowMapper<TrackedPackage> packageMapper = (rs, rowNum) -> new TrackedPackage(
            rs.getLong("id"),
            rs.getString("tracking_number"),
            rs.getString("carrier"),
            PackageStatus.fromCode(rs.getString("status")),
            toInstant(rs, "last_update"),
            toInstant(rs, "created_at")
    );

    private final RowMapper<TrackingEvent> eventMapper = (rs, rowNum) -> new TrackingEvent(
            toInstant(rs, "event_time"),
            rs.getString("location"),
            rs.getString("description")
    );

    public PackageRepository(
            NamedParameterJdbcTemplate jdbcTemplate,
            SqlTemplateLoader sqlLoader,
            @Value("${app.db.max-retries:2}") int maxRetries,
            @Value("${app.db.retry-delay-ms:100}") long retryDelayMs) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
        log.info("PackageRepository initialized with maxRetries: {}, retryDelayMs: {}ms", maxRetries, retryDelayMs);
    }

    // ═══════════════════════════════════════════════════════════════
    // PACKAGES
    // ═══════════════════════════════════════════════════════════════

    /**
     * Insert a new package.
     *
     * @throws DuplicatePackageException if the tracking number is already stored
     * @throws ValidationException if a value violates any other column constraint
     */
    public TrackedPackage insert(String trackingNumber, String carrier, PackageStatus status, Instant createdAt) {
        Instant created = createdAt.truncatedTo(ChronoUnit.MICROS);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("trackingNumber", trackingNumber)
                .addValue("carrier", carrier)
                .addValue("status", status.code())
                .addValue("createdAt", toTimestamp(created), Types.TIMESTAMP_WITH_TIMEZONE);

        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(sqlLoader.load("insertPackage"), params, keyHolder, new String[] {GENERATED_ID_COLUMN});
        } catch (DuplicateKeyException e) {
            throw new DuplicatePackageException(trackingNumber);
        } catch (DataIntegrityViolationException e) {
            throw new ValidationException("Package " + trackingNumber + " rejected by the store: "
                    + e.getMostSpecificCause().getMessage(), e);
        }

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No generated id returned for package " + trackingNumber);
        }
        log.debug("Inserted package {} with id {}", trackingNumber, key);
        return new TrackedPackage(key.longValue(), trackingNumber, carrier, status, null, created);
    }

    public Optional<TrackedPackage> findByTrackingNumber(String trackingNumber) {
        return queryForPackage("findPackageByTrackingNumber", trackingNumber);
    }

    /**
     * Same as {@link #findByTrackingNumber(String)} but takes a row lock held until the
     * surrounding transaction ends.
     */
    public Optional<TrackedPackage> lockByTrackingNumber(String trackingNumber) {
        return queryForPackage("lockPackageByTrackingNumber", trackingNumber);
    }

    /**
     * All packages, most recently created first, optionally restricted to one status.
     */
    public List<TrackedPackage> findAll(PackageStatus statusFilter) {
        if (statusFilter == null) {
            return withRetry("findAllPackages", () ->
                    jdbcTemplate.query(sqlLoader.load("findAllPackages"), packageMapper));
        }
        SqlParameterSource params = new MapSqlParameterSource("status", statusFilter.code());
        return withRetry("findPackagesByStatus", () ->
                jdbcTemplate.query(sqlLoader.load("findPackagesByStatus"), params, packageMapper));
    }

    public List<String> findAllTrackingNumbers() {
        return withRetry("findAllTrackingNumbers", () ->
                jdbcTemplate.getJdbcTemplate().queryForList(sqlLoader.load("findAllTrackingNumbers"), String.class));
    }

    public void updateStatus(long packageId, PackageStatus status, Instant lastUpdate) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", packageId)
                .addValue("status", status.code())
                .addValue("lastUpdate", toTimestamp(lastUpdate), Types.TIMESTAMP_WITH_TIMEZONE);
        jdbcTemplate.update(sqlLoader.load("updatePackageStatus"), params);
    }

    /**
     * Remove a package and its events. Returns false if no package row was deleted.
     */
    public boolean delete(long packageId) {
        SqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", packageId)
                .addValue("packageId", packageId);
        int events = jdbcTemplate.update(sqlLoader.load("deleteEventsByPackageId"), params);
        int packages = jdbcTemplate.update(sqlLoader.load("deletePackage"), params);
        log.debug("Deleted package id {} ({} events)", packageId, events);
        return packages > 0;
    }

    // ═══════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Ledger of a package, newest first, events without a timestamp last.
     */
    public List<TrackingEvent> findEvents(long packageId) {
        SqlParameterSource params = new MapSqlParameterSource("packageId", packageId);
        return jdbcTemplate.query(sqlLoader.load("findEventsByPackageId"), params, eventMapper);
    }

    public Set<TrackingEvent.Key> findEventKeys(long packageId) {
        Set<TrackingEvent.Key> keys = new LinkedHashSet<>();
        for (TrackingEvent event : findEvents(packageId)) {
            keys.add(event.key());
        }
        return keys;
    }

    public int insertEvents(long packageId, List<TrackingEvent> events) {
        if (events.isEmpty()) {
            return 0;
        }
        SqlParameterSource[] batch = events.stream()
                .map(e -> new MapSqlParameterSource()
                        .addValue("packageId", packageId)
                        .addValue("eventTime", toTimestamp(e.timestamp()), Types.TIMESTAMP_WITH_TIMEZONE)
                        .addValue("location", e.location())
                        .addValue("description", e.description()))
                .toArray(SqlParameterSource[]::new);
        jdbcTemplate.batchUpdate(sqlLoader.load("insertEvent"), batch);
        return batch.length;
    }

    public long countEvents(long packageId) {
        Long count = jdbcTemplate.queryForObject(sqlLoader.load("countEventsByPackageId"),
                new MapSqlParameterSource("packageId", packageId), Long.class);
        return count != null ? count : 0L;
    }

    public long countOrphanEvents() {
        Long count = jdbcTemplate.getJdbcTemplate().queryForObject(sqlLoader.load("countOrphanEvents"), Long.class);
        return count != null ? count : 0L;
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════

    private Optional<TrackedPackage> queryForPackage(String queryName, String trackingNumber) {
        SqlParameterSource params = new MapSqlParameterSource("trackingNumber", trackingNumber);
        List<TrackedPackage> rows = jdbcTemplate.query(sqlLoader.load(queryName), params, packageMapper);
        return rows.stream().findFirst();
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    /**
     * Retry wrapper for transient DB failures on reads.
     * Retries up to `maxRetries` times with exponential backoff and jitter.
     */
    private <T> T withRetry(String operationName, Supplier<T> operation) {
        int attempt = 0;
        final int totalAttempts = maxRetries + 1;
        while (true) {
            try {
                attempt++;
                return operation.get();
            } catch (TransientDataAccessException e) {
                if (attempt > maxRetries) {
                    log.error("Operation '{}' failed after {} attempts: {}",
                            operationName, attempt, e.getMessage());
                    throw e;
                }

                // exponential backoff: base * 2^(attempt-1)
                long baseDelay = retryDelayMs * (1L << (attempt - 1));
                long jitter = ThreadLocalRandom.current().nextLong(0, Math.max(1L, Math.min(1000L, baseDelay)));
                long delay = Math.min(baseDelay + jitter, 60000L);

                log.warn("Operation '{}' failed (attempt {}/{}), retrying in {}ms: {}",
                        operationName, attempt, totalAttempts, delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
