package com.eventfacts.infrastructure.cache;

import com.eventfacts.domain.model.TimeSeriesResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache for computed series.
 *
 * Keys embed the store's data version (latest occurrence or definition write),
 * so a sync pass moves every reader onto fresh keys and old entries simply expire.
 *
 * Failure Handling:
 * - circuit breaker "redis" stops calling Redis after repeated failures
 * - every failure degrades to a cache miss; queries never fail because of the cache
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    private static final String SERIES_PREFIX = "facts:series";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getSeriesFallback")
    public Optional<TimeSeriesResult> getSeries(String key) {
        try {
            String cached = redisTemplate.opsForValue().get(key);

            if (cached == null) {
                log.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }

            TimeSeriesResult value = objectMapper.readValue(cached, TimeSeriesResult.class);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);

        } catch (Exception e) {
            log.error("Error reading from cache: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "putSeriesFallback")
    public void putSeries(String key, TimeSeriesResult series, long ttlSeconds) {
        try {
            String json = objectMapper.writeValueAsString(series);
            redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
            log.debug("Cached series for key: {} (TTL: {}s)", key, ttlSeconds);

        } catch (Exception e) {
            // a failed cache write must not fail the query
            log.error("Error writing to cache: {}", e.getMessage());
        }
    }

    /**
     * facts:series:&lt;dataVersion&gt;:&lt;target&gt;:&lt;from&gt;:&lt;to&gt;:&lt;labels&gt;
     */
    public String seriesKey(Instant dataVersion, String target, Instant from, Instant to, List<String> labels) {
        return String.join(":",
                SERIES_PREFIX,
                dataVersion != null ? String.valueOf(dataVersion.toEpochMilli()) : "none",
                target,
                String.valueOf(from.toEpochMilli()),
                String.valueOf(to.toEpochMilli()),
                labels == null || labels.isEmpty() ? "*" : String.join(",", labels));
    }

    // Fallback methods (circuit breaker)

    private Optional<TimeSeriesResult> getSeriesFallback(String key, Exception e) {
        log.warn("Redis circuit breaker open, computing series from the database");
        return Optional.empty();
    }

    private void putSeriesFallback(String key, TimeSeriesResult series, long ttlSeconds, Exception e) {
        log.warn("Redis circuit breaker open, skipping cache write");
    }
}
