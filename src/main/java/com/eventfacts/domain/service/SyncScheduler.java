package com.eventfacts.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic window sync, top of every hour by default.
 *
 * A failing run is logged and swallowed here so the next tick still fires.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.sync.enabled", havingValue = "true", matchIfMissing = true)
public class SyncScheduler {

    private final SyncService syncService;

    @Scheduled(cron = "${app.sync.cron:0 0 * * * *}")
    public void scheduledSync() {
        log.info("Hourly sync triggered");
        try {
            syncService.syncWindowIfIdle();
        } catch (Exception e) {
            log.error("Scheduled sync failed: {}", e.getMessage(), e);
        }
    }
}
