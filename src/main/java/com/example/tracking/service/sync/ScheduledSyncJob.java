package com.example.tracking.service.sync;

import com.example.tracking.config.TraceContextManager;
import com.example.tracking.model.SyncResult;
import com.example.tracking.service.TrackingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sync of every tracked package.
 * Enabled with app.sync.schedule.enabled=true; interval is an ISO-8601 duration.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "app.sync.schedule.enabled", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class ScheduledSyncJob {

    private final ReconciliationService reconciliationService;

    @Scheduled(fixedDelayString = "${app.sync.schedule.interval:PT30M}",
               initialDelayString = "${app.sync.schedule.initial-delay:PT1M}")
    public void run() {
        TraceContextManager.startBackground();
        try {
            SyncResult result = reconciliationService.syncAll();
            if (!result.success()) {
                log.warn("Scheduled sync finished with {} merge failures", result.failures().size());
            }
        } catch (TrackingException e) {
            // next run retries
            log.error("Scheduled sync failed: {}", e.getMessage());
        } finally {
            TraceContextManager.clear();
        }
    }
}
