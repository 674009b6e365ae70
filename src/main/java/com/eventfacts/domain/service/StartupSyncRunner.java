package com.eventfacts.domain.service;

import com.eventfacts.infrastructure.upstream.UpstreamClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Authenticates against the upstream system and brings the store up to date
 * before the service settles. Any exception here aborts startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.sync.enabled", havingValue = "true", matchIfMissing = true)
public class StartupSyncRunner implements ApplicationRunner {

    private final UpstreamClient upstreamClient;
    private final SyncService syncService;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Authenticating with upstream...");
        upstreamClient.authenticate();

        log.info("Performing initial data sync...");
        syncService.performInitialSync();
    }
}
