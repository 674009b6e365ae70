package com.eventfacts.domain.service;

import com.eventfacts.domain.model.AggregationKind;
import com.eventfacts.domain.model.Annotation;
import com.eventfacts.domain.model.AnnotationRequest;
import com.eventfacts.domain.model.GrafanaQueryRequest;
import com.eventfacts.domain.model.MetricKind;
import com.eventfacts.domain.model.MetricOption;
import com.eventfacts.domain.model.QueryTarget;
import com.eventfacts.domain.model.SeriesPoint;
import com.eventfacts.domain.model.TargetKey;
import com.eventfacts.domain.model.TimeRange;
import com.eventfacts.domain.model.TimeSeriesResult;
import com.eventfacts.infrastructure.cache.QueryCacheService;
import com.eventfacts.infrastructure.persistence.MetricStore;
import com.eventfacts.infrastructure.persistence.entity.MetricDefinitionEntity;
import com.eventfacts.infrastructure.persistence.entity.OccurrenceEntity;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GrafanaQueryService.
 *
 * Covers target parsing, empty series suppression and the cache path.
 */
@ExtendWith(MockitoExtension.class)
class GrafanaQueryServiceTest {

    private static final String FROM = "2024-01-01T00:00:00Z";
    private static final String TO = "2024-12-31T23:59:59Z";

    @Mock
    private AggregationService aggregationService;

    @Mock
    private MetricStore metricStore;

    @Mock
    private QueryCacheService cacheService;

    private MeterRegistry meterRegistry;
    private GrafanaQueryService queryService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queryService = new GrafanaQueryService(aggregationService, metricStore, cacheService, meterRegistry, 300);
    }

    @Test
    void testQuery_SkipsMalformedTargets() {
        // Given
        stubCacheMiss();
        TimeSeriesResult series = series("Attendance - Monthly Sum", 10.0);
        when(aggregationService.aggregate(eq(new TargetKey(5, AggregationKind.MONTHLY)), any(), any(), anyList()))
                .thenReturn(series);

        GrafanaQueryRequest request = request(
                QueryTarget.builder().target("foo_bar").build(),
                QueryTarget.builder().target("fact_5_weekly").build(),
                QueryTarget.builder().target("fact_5_monthly").build());

        // When
        List<TimeSeriesResult> result = queryService.query(request);

        // Then
        assertEquals(1, result.size());
        assertEquals("Attendance - Monthly Sum", result.get(0).getTarget());
        verify(aggregationService, times(1)).aggregate(any(), any(), any(), anyList());
    }

    @Test
    void testQuery_OmitsEmptySeries() {
        // Given
        stubCacheMiss();
        when(aggregationService.aggregate(any(), any(), any(), anyList()))
                .thenReturn(TimeSeriesResult.builder().target("Attendance - Raw Data").datapoints(List.of()).build());

        // When
        List<TimeSeriesResult> result = queryService.query(request(QueryTarget.builder().target("fact_5_raw").build()));

        // Then
        assertTrue(result.isEmpty());
    }

    @Test
    void testQuery_CacheHit() {
        // Given
        TimeSeriesResult cached = series("Attendance - Yearly Sum", 30.0);
        when(cacheService.seriesKey(any(), anyString(), any(), any(), anyList())).thenReturn("k");
        when(cacheService.getSeries("k")).thenReturn(Optional.of(cached));

        // When
        List<TimeSeriesResult> result = queryService.query(request(QueryTarget.builder().target("fact_5_yearly_sum").build()));

        // Then
        assertEquals(List.of(cached), result);
        verify(aggregationService, never()).aggregate(any(), any(), any(), anyList());
        verify(cacheService, never()).putSeries(anyString(), any(), anyLong());
        assertEquals(1.0, meterRegistry.get("query.cache").tag("result", "hit").counter().count());
    }

    @Test
    void testQuery_CacheMissStoresSeries() {
        // Given
        stubCacheMiss();
        TimeSeriesResult series = series("Attendance - Raw Data", 10.0);
        when(aggregationService.aggregate(any(), any(), any(), anyList())).thenReturn(series);

        // When
        queryService.query(request(QueryTarget.builder().target("fact_5_raw").build()));

        // Then
        verify(cacheService).putSeries("k", series, 300);
        assertEquals(1.0, meterRegistry.get("query.cache").tag("result", "miss").counter().count());
    }

    @Test
    void testQuery_PassesResolvedFilterAndDataVersion() {
        // Given
        Instant dataVersion = Instant.parse("2024-03-01T12:00:00Z");
        when(metricStore.findDataVersion()).thenReturn(Optional.of(dataVersion));
        when(cacheService.seriesKey(any(), anyString(), any(), any(), anyList())).thenReturn("k");
        when(cacheService.getSeries("k")).thenReturn(Optional.empty());
        when(aggregationService.aggregate(any(), any(), any(), anyList())).thenReturn(series("s", 1.0));

        QueryTarget target = QueryTarget.builder()
                .target("fact_5_monthly")
                .payload(Map.of(QueryTarget.FILTER_PAYLOAD, List.of("X", "Y")))
                .build();

        // When
        queryService.query(request(target));

        // Then
        Instant from = Instant.parse(FROM);
        Instant to = Instant.parse(TO);
        verify(cacheService).seriesKey(dataVersion, "fact_5_monthly", from, to, List.of("X", "Y"));
        verify(aggregationService).aggregate(new TargetKey(5, AggregationKind.MONTHLY), from, to, List.of("X", "Y"));
    }

    @Test
    void testQuery_InvalidRangeRejected() {
        GrafanaQueryRequest request = GrafanaQueryRequest.builder()
                .targets(List.of(QueryTarget.builder().target("fact_5_raw").build()))
                .range(new TimeRange("yesterday", TO))
                .build();

        assertThrows(IllegalArgumentException.class, () -> queryService.query(request));
    }

    @Test
    void testListMetrics_FourOptionsPerNumericMetric() {
        // Given
        when(metricStore.listCategoryLabels()).thenReturn(List.of("X", "Y"));
        when(metricStore.listNumericDefinitions()).thenReturn(List.of(MetricDefinitionEntity.builder()
                .id(5L).name("Attendance").translatedName("Attendance").kind(MetricKind.NUMERIC).unit("people").build()));

        // When
        List<MetricOption> options = queryService.listMetrics();

        // Then
        assertEquals(List.of("fact_5_raw", "fact_5_monthly", "fact_5_yearly_sum", "fact_5_yearly_mean"),
                options.stream().map(MetricOption::getValue).toList());
        assertEquals("Attendance (people) - Monthly Sum", options.get(1).getLabel());
        assertEquals(QueryTarget.FILTER_PAYLOAD, options.get(0).getPayloads().get(0).getName());
        assertEquals(2, options.get(0).getPayloads().get(0).getOptions().size());
    }

    @Test
    void testAnnotations_OnePerOccurrence() {
        // Given
        Instant start = Instant.parse("2024-01-15T10:00:00Z");
        when(metricStore.findOccurrences(any(), any())).thenReturn(List.of(OccurrenceEntity.builder()
                .id(1L).name("Sunday Service").startDate(start).build()));

        // When
        List<Annotation> annotations = queryService.annotations(new AnnotationRequest(new TimeRange(FROM, TO)));

        // Then
        assertEquals(1, annotations.size());
        assertEquals(start.toEpochMilli(), annotations.get(0).getTime());
        assertNull(annotations.get(0).getTimeEnd());
        assertEquals(List.of("Sunday Service"), annotations.get(0).getTags());
    }

    @Test
    void testTagValues_OnlyForCategoryKey() {
        when(metricStore.listCategoryLabels()).thenReturn(List.of("X"));

        assertEquals(List.of(Map.of("text", "X")), queryService.tagValues("category"));
        assertTrue(queryService.tagValues("room").isEmpty());
    }

    private void stubCacheMiss() {
        when(cacheService.seriesKey(any(), anyString(), any(), any(), anyList())).thenReturn("k");
        when(cacheService.getSeries("k")).thenReturn(Optional.empty());
    }

    private static GrafanaQueryRequest request(QueryTarget... targets) {
        return GrafanaQueryRequest.builder()
                .targets(List.of(targets))
                .range(new TimeRange(FROM, TO))
                .build();
    }

    private static TimeSeriesResult series(String target, double value) {
        return TimeSeriesResult.builder()
                .target(target)
                .datapoints(List.of(new SeriesPoint(value, 1704067200000L)))
                .build();
    }
}
