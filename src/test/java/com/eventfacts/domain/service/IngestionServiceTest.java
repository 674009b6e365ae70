package com.eventfacts.domain.service;

import com.eventfacts.domain.exception.UpstreamFetchException;
import com.eventfacts.domain.model.DateRange;
import com.eventfacts.domain.model.IngestionBatch;
import com.eventfacts.domain.model.MetricSample;
import com.eventfacts.domain.model.Occurrence;
import com.eventfacts.infrastructure.upstream.UpstreamClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IngestionService.
 *
 * Batching, ordering and per-occurrence failure isolation.
 */
@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final DateRange RANGE = new DateRange(
            LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31));

    @Mock
    private UpstreamClient upstreamClient;

    private ExecutorService executor;
    private MeterRegistry meterRegistry;
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        meterRegistry = new SimpleMeterRegistry();
        ingestionService = new IngestionService(upstreamClient, executor, meterRegistry, 3, Duration.ZERO);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testFetchRange_SamplesInOccurrenceOrder() {
        // Given: 7 occurrences, batches of 3
        when(upstreamClient.fetchOccurrences(RANGE)).thenReturn(occurrences(7));
        when(upstreamClient.fetchSamples(anyLong())).thenAnswer(inv -> List.of(sample(inv.getArgument(0))));

        // When
        IngestionBatch batch = ingestionService.fetchRange(RANGE);

        // Then
        assertEquals(7, batch.occurrences().size());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L),
                batch.samples().stream().map(MetricSample::getOccurrenceId).toList());
    }

    @Test
    void testFetchRange_FailingOccurrenceDoesNotAbortBatch() {
        // Given
        when(upstreamClient.fetchOccurrences(RANGE)).thenReturn(occurrences(3));
        when(upstreamClient.fetchSamples(anyLong())).thenAnswer(inv -> {
            long id = inv.getArgument(0);
            if (id == 2L) {
                throw new UpstreamFetchException("Error fetching facts for event 2");
            }
            return List.of(sample(id));
        });

        // When
        IngestionBatch batch = ingestionService.fetchRange(RANGE);

        // Then
        assertEquals(3, batch.occurrences().size());
        assertEquals(List.of(1L, 3L), batch.samples().stream().map(MetricSample::getOccurrenceId).toList());
        assertEquals(1.0, meterRegistry.get("ingestion.sample_fetch.failures").counter().count());
    }

    @Test
    void testFetchRange_NeverExceedsBatchSizeInFlight() {
        // Given
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(upstreamClient.fetchOccurrences(RANGE)).thenReturn(occurrences(10));
        when(upstreamClient.fetchSamples(anyLong())).thenAnswer(inv -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(5);
            inFlight.decrementAndGet();
            return List.of();
        });

        // When
        ingestionService.fetchRange(RANGE);

        // Then
        assertTrue(maxInFlight.get() <= 3);
        verify(upstreamClient, times(10)).fetchSamples(anyLong());
    }

    @Test
    void testFetchRange_OccurrenceFailurePropagates() {
        // Given
        when(upstreamClient.fetchOccurrences(RANGE)).thenThrow(new UpstreamFetchException("Error fetching events"));

        // When / Then
        assertThrows(UpstreamFetchException.class, () -> ingestionService.fetchRange(RANGE));
        verify(upstreamClient, never()).fetchSamples(anyLong());
    }

    @Test
    void testFetchYearPaced_RequestsWholeYearSerially() {
        // Given
        when(upstreamClient.fetchOccurrences(DateRange.ofYear(2023))).thenReturn(occurrences(12));
        when(upstreamClient.fetchSamples(anyLong())).thenAnswer(inv -> List.of(sample(inv.getArgument(0))));

        // When
        IngestionBatch batch = ingestionService.fetchYearPaced(2023);

        // Then
        assertEquals(12, batch.samples().size());
        assertEquals(12L, batch.samples().get(11).getOccurrenceId());
    }

    private static List<Occurrence> occurrences(int count) {
        return LongStream.rangeClosed(1, count)
                .mapToObj(id -> Occurrence.builder()
                        .id(id)
                        .name("Event " + id)
                        .startDate(Instant.parse("2024-01-01T10:00:00Z").plus(Duration.ofDays(id)))
                        .build())
                .toList();
    }

    private static MetricSample sample(long occurrenceId) {
        return MetricSample.builder().occurrenceId(occurrenceId).metricId(5).numericValue(1.0).build();
    }
}
