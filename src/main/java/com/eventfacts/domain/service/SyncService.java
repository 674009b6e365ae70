package com.eventfacts.domain.service;

import com.eventfacts.domain.exception.SyncAlreadyRunningException;
import com.eventfacts.domain.exception.SyncFailedException;
import com.eventfacts.domain.model.DateRange;
import com.eventfacts.domain.model.IngestionBatch;
import com.eventfacts.domain.model.MetricDefinition;
import com.eventfacts.domain.model.SyncResult;
import com.eventfacts.infrastructure.persistence.MetricStore;
import com.eventfacts.infrastructure.upstream.UpstreamClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Keeps the local store in step with the upstream system.
 *
 * Pass Flow:
 * 1. Acquire the single-flight gate (or reject / skip)
 * 2. Upsert the full metric definition snapshot
 * 3. Fetch occurrences and samples for the pass range
 * 4. Apply occurrences, then samples, in one transaction
 * 5. Release the gate
 *
 * Entry Points:
 * - window sync: previous, current and next month; scheduled, startup and on demand
 * - year backfill: one calendar year through the paced ingestion path
 *
 * Failure Handling:
 * - any failure aborts the pass and surfaces as SyncFailedException
 * - nothing is retried; the next trigger starts a fresh pass
 */
@Slf4j
@Service
public class SyncService {

    static final String TYPE_WINDOW = "window";
    static final String TYPE_BACKFILL = "backfill";

    private final IngestionService ingestionService;
    private final MetricStore metricStore;
    private final UpstreamClient upstreamClient;
    private final SyncGate syncGate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration freshnessThreshold;

    public SyncService(
            IngestionService ingestionService,
            MetricStore metricStore,
            UpstreamClient upstreamClient,
            SyncGate syncGate,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${app.sync.freshness-threshold:1h}") Duration freshnessThreshold) {
        this.ingestionService = ingestionService;
        this.metricStore = metricStore;
        this.upstreamClient = upstreamClient;
        this.syncGate = syncGate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.freshnessThreshold = freshnessThreshold;
    }

    /**
     * On-demand window sync.
     *
     * @throws SyncAlreadyRunningException if another pass holds the gate
     */
    public SyncResult syncWindow() {
        if (!syncGate.tryAcquire()) {
            recordRun(TYPE_WINDOW, "rejected");
            throw new SyncAlreadyRunningException();
        }
        try {
            return runPass(TYPE_WINDOW, this::windowBatch);
        } finally {
            syncGate.release();
        }
    }

    /**
     * Window sync for the scheduler and startup: a busy gate is a silent skip.
     */
    public Optional<SyncResult> syncWindowIfIdle() {
        if (!syncGate.tryAcquire()) {
            log.info("Sync already in progress, skipping...");
            recordRun(TYPE_WINDOW, "skipped");
            return Optional.empty();
        }
        try {
            return Optional.of(runPass(TYPE_WINDOW, this::windowBatch));
        } finally {
            syncGate.release();
        }
    }

    /**
     * Re-syncs one calendar year end to end.
     *
     * @throws SyncAlreadyRunningException if another pass holds the gate
     */
    public SyncResult backfillYear(int year) {
        if (!syncGate.tryAcquire()) {
            recordRun(TYPE_BACKFILL, "rejected");
            throw new SyncAlreadyRunningException();
        }
        try {
            log.info("Starting full year sync for {}...", year);
            return runPass(TYPE_BACKFILL, () -> ingestionService.fetchYearPaced(year));
        } finally {
            syncGate.release();
        }
    }

    /**
     * Runs a window sync when the store was never synced or the watermark is
     * older than the freshness threshold.
     */
    public Optional<SyncResult> performInitialSync() {
        Optional<Instant> lastSync = metricStore.findWatermark();
        if (lastSync.isEmpty()) {
            log.info("No previous sync found, starting full sync...");
            return syncWindowIfIdle();
        }

        Duration age = Duration.between(lastSync.get(), clock.instant());
        log.info("Last sync was {} minutes ago", age.toMinutes());
        if (age.compareTo(freshnessThreshold) > 0) {
            log.info("Last sync is older than {}, starting sync...", freshnessThreshold);
            return syncWindowIfIdle();
        }

        log.info("Recent sync found, skipping initial sync");
        return Optional.empty();
    }

    public boolean isRunning() {
        return syncGate.isRunning();
    }

    private IngestionBatch windowBatch() {
        DateRange window = DateRange.rollingWindow(LocalDate.now(clock));
        log.info("Fetching events and facts for {}...", window);
        return ingestionService.fetchRange(window);
    }

    private SyncResult runPass(String type, Supplier<IngestionBatch> fetch) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = clock.millis();
        log.info("Starting {} sync...", type);

        try {
            if (!upstreamClient.isAuthenticated()) {
                upstreamClient.authenticate();
            }

            log.info("Fetching master data...");
            List<MetricDefinition> definitions = ingestionService.fetchMetricDefinitions();
            log.info("Syncing {} facts...", definitions.size());
            metricStore.upsertMetricDefinitions(definitions, clock.instant());

            IngestionBatch batch = fetch.get();
            log.info("Syncing {} events and {} event facts...", batch.occurrences().size(), batch.samples().size());
            Instant completedAt = clock.instant();
            metricStore.applyBatch(batch, completedAt);

            SyncResult result = SyncResult.builder()
                    .type(type)
                    .metricDefinitions(definitions.size())
                    .occurrences(batch.occurrences().size())
                    .samples(batch.samples().size())
                    .completedAt(completedAt)
                    .durationMs(clock.millis() - startTime)
                    .build();

            sample.stop(Timer.builder("sync.duration")
                    .tag("type", type)
                    .register(meterRegistry));
            recordRun(type, "success");

            log.info("{} sync completed successfully at {}", type, completedAt);
            return result;

        } catch (RuntimeException e) {
            log.error("Error during {} sync: {}", type, e.getMessage(), e);
            recordRun(type, "failure");
            throw new SyncFailedException(type + " sync failed: " + e.getMessage(), e);
        }
    }

    private void recordRun(String type, String result) {
        Counter.builder("sync.runs")
                .tag("type", type)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
