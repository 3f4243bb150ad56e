package com.hospitality.staysync.scheduler;

import com.hospitality.staysync.dto.SyncResult;
import com.hospitality.staysync.service.PmsSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Daily pull of tomorrow's check-ins from every PMS.
 * <p>
 * Runs at midnight so stays and guests are in place before arrival day starts.
 * Each PMS is pulled independently; a failing vendor is logged and the
 * next run simply tries again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaySyncScheduler {

    private final PmsSyncService syncService;

    @Value("${pms.sync.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(cron = "${pms.sync.scheduler.cron:0 0 0 * * *}", zone = "${pms.sync.scheduler.zone:}")
    public void pullTomorrowsStays() {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping daily pull");
            return;
        }

        log.info("Starting scheduled pull of tomorrow's stays");

        try {
            List<SyncResult> results = syncService.pullTomorrowsStaysForAll();
            results.forEach(this::logResult);

            long failed = results.stream().filter(result -> !result.isSuccessful()).count();
            if (failed > 0) {
                log.warn("Daily pull failed for {} of {} PMS", failed, results.size());
            }
        } catch (Exception e) {
            log.error("Scheduled pull failed with unexpected error", e);
        }
    }

    private void logResult(SyncResult result) {
        if (!result.isSuccessful()) {
            log.warn("{} daily pull failed: {}", result.getPmsName(), result.getFailureReason());
        } else if (result.getTotalItems() == 0) {
            log.info("{} has no stays checking in tomorrow", result.getPmsName());
        } else {
            log.info("{} daily pull completed in {}ms: {} reservations, {} reconciled, {} skipped",
                    result.getPmsName(),
                    result.getDurationMs(),
                    result.getTotalItems(),
                    result.getReconciled(),
                    result.getSkipped());
        }
    }
}
