package com.eventfacts.domain.service;

import com.eventfacts.domain.exception.UpstreamFetchException;
import com.eventfacts.domain.model.DateRange;
import com.eventfacts.domain.model.IngestionBatch;
import com.eventfacts.domain.model.MetricDefinition;
import com.eventfacts.domain.model.MetricSample;
import com.eventfacts.domain.model.Occurrence;
import com.eventfacts.infrastructure.upstream.UpstreamClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Pulls occurrences and their samples from the upstream system.
 *
 * Two retrieval modes:
 * - batched: occurrences are split into fixed-size batches, the samples of one
 *   batch are fetched concurrently and the batch completes before the next starts
 * - paced: one request at a time with a fixed pause in between, used for
 *   year backfills to keep the request rate low
 *
 * Failure Handling:
 * - definitions / occurrences: failures propagate and abort the caller's pass
 * - samples of a single occurrence: logged, counted, replaced by an empty list
 *
 * No persistence happens here.
 */
@Slf4j
@Service
public class IngestionService {

    private final UpstreamClient upstreamClient;
    private final Executor ingestionExecutor;
    private final MeterRegistry meterRegistry;
    private final int batchSize;
    private final Duration backfillDelay;

    public IngestionService(
            UpstreamClient upstreamClient,
            @Qualifier("ingestionExecutor") Executor ingestionExecutor,
            MeterRegistry meterRegistry,
            @Value("${app.ingestion.batch-size:10}") int batchSize,
            @Value("${app.ingestion.backfill-delay:10ms}") Duration backfillDelay) {
        this.upstreamClient = upstreamClient;
        this.ingestionExecutor = ingestionExecutor;
        this.meterRegistry = meterRegistry;
        this.batchSize = Math.max(1, batchSize);
        this.backfillDelay = backfillDelay == null ? Duration.ZERO : backfillDelay;
    }

    public List<MetricDefinition> fetchMetricDefinitions() {
        return upstreamClient.fetchMetricDefinitions();
    }

    /**
     * Occurrences in the range plus their samples, fetched batch by batch.
     */
    public IngestionBatch fetchRange(DateRange range) {
        List<Occurrence> occurrences = upstreamClient.fetchOccurrences(range);
        log.info("Fetching facts for {} events in {} (batch size {})", occurrences.size(), range, batchSize);

        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < occurrences.size(); i += batchSize) {
            List<Occurrence> batch = occurrences.subList(i, Math.min(i + batchSize, occurrences.size()));
            List<CompletableFuture<List<MetricSample>>> futures = batch.stream()
                    .map(occurrence -> CompletableFuture.supplyAsync(
                            () -> fetchSamplesIsolated(occurrence.getId()), ingestionExecutor))
                    .toList();
            // join in submission order so the result order is stable
            for (CompletableFuture<List<MetricSample>> future : futures) {
                samples.addAll(future.join());
            }
        }
        return new IngestionBatch(occurrences, samples);
    }

    /**
     * All occurrences of a calendar year, samples fetched serially with a pause between requests.
     */
    public IngestionBatch fetchYearPaced(int year) {
        List<Occurrence> occurrences = upstreamClient.fetchOccurrences(DateRange.ofYear(year));
        log.info("Fetching facts for {} events with {}ms delay...", occurrences.size(), backfillDelay.toMillis());

        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < occurrences.size(); i++) {
            samples.addAll(fetchSamplesIsolated(occurrences.get(i).getId()));

            if (i < occurrences.size() - 1) {
                pause();
            }
            if ((i + 1) % 10 == 0) {
                log.info("  Processed {}/{} events...", i + 1, occurrences.size());
            }
        }
        log.info("Completed fetching facts for {} events", occurrences.size());
        return new IngestionBatch(occurrences, samples);
    }

    private List<MetricSample> fetchSamplesIsolated(long occurrenceId) {
        try {
            return upstreamClient.fetchSamples(occurrenceId);
        } catch (RuntimeException e) {
            log.warn("Error fetching facts for event {}, continuing without them: {}", occurrenceId, e.getMessage());
            Counter.builder("ingestion.sample_fetch.failures")
                    .register(meterRegistry)
                    .increment();
            return List.of();
        }
    }

    private void pause() {
        if (backfillDelay.isZero() || backfillDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backfillDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException("Interrupted while pacing upstream requests", e);
        }
    }
}
