package com.eventfacts.infrastructure.cache;

import com.eventfacts.domain.model.SeriesPoint;
import com.eventfacts.domain.model.TimeSeriesResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for QueryCacheService. The circuit breaker aspect is not active
 * here; the in-method degradation to a miss is what is tested.
 */
@ExtendWith(MockitoExtension.class)
class QueryCacheServiceTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private QueryCacheService cacheService;

    @BeforeEach
    void setUp() {
        cacheService = new QueryCacheService(redisTemplate, new ObjectMapper());
    }

    @Test
    void testGetSeries_HitDeserializesGrafanaShape() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenReturn(
                "{\"target\":\"Attendance - Raw Data\",\"datapoints\":[[10.0,1704067200000]],\"unit\":\"people\"}");

        // When
        Optional<TimeSeriesResult> result = cacheService.getSeries("k");

        // Then
        assertTrue(result.isPresent());
        assertEquals(List.of(new SeriesPoint(10.0, 1704067200000L)), result.get().getDatapoints());
        assertEquals("people", result.get().getUnit());
    }

    @Test
    void testGetSeries_RedisFailureIsAMiss() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));

        // When / Then
        assertEquals(Optional.empty(), cacheService.getSeries("k"));
    }

    @Test
    void testPutSeries_WritesJsonWithTtl() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        TimeSeriesResult series = TimeSeriesResult.builder()
                .target("Attendance - Raw Data")
                .datapoints(List.of(new SeriesPoint(10.0, 1704067200000L)))
                .build();

        // When
        cacheService.putSeries("k", series, 300);

        // Then
        verify(valueOperations).set(eq("k"),
                eq("{\"target\":\"Attendance - Raw Data\",\"datapoints\":[[10.0,1704067200000]]}"),
                eq(300L), eq(TimeUnit.SECONDS));
    }

    @Test
    void testSeriesKey_EmbedsWatermarkAndFilter() {
        Instant from = Instant.ofEpochMilli(1000);
        Instant to = Instant.ofEpochMilli(2000);

        assertEquals("facts:series:5000:fact_5_raw:1000:2000:X,Y",
                cacheService.seriesKey(Instant.ofEpochMilli(5000), "fact_5_raw", from, to, List.of("X", "Y")));
        assertEquals("facts:series:none:fact_5_raw:1000:2000:*",
                cacheService.seriesKey(null, "fact_5_raw", from, to, List.of()));
    }
}
