package com.eventfacts.domain.service;

import com.eventfacts.domain.model.AggregationKind;
import com.eventfacts.domain.model.Annotation;
import com.eventfacts.domain.model.AnnotationRequest;
import com.eventfacts.domain.model.GrafanaQueryRequest;
import com.eventfacts.domain.model.MetricOption;
import com.eventfacts.domain.model.MetricPayload;
import com.eventfacts.domain.model.QueryTarget;
import com.eventfacts.domain.model.TargetKey;
import com.eventfacts.domain.model.TimeRange;
import com.eventfacts.domain.model.TimeSeriesResult;
import com.eventfacts.infrastructure.cache.QueryCacheService;
import com.eventfacts.infrastructure.persistence.MetricStore;
import com.eventfacts.infrastructure.persistence.entity.MetricDefinitionEntity;
import com.eventfacts.infrastructure.persistence.entity.OccurrenceEntity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Grafana JSON datasource semantics on top of the aggregation engine.
 *
 * Query Flow (per target):
 * 1. Parse the composite key; anything malformed is skipped without error
 * 2. Resolve the category filter
 * 3. Check cache (Redis), keyed by data version + target + range + filter
 * 4. On miss, aggregate from the store and cache the result
 * 5. Keep the series only if it has datapoints
 */
@Slf4j
@Service
public class GrafanaQueryService {

    public static final String TAG_KEY_CATEGORY = "category";

    private final AggregationService aggregationService;
    private final MetricStore metricStore;
    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;
    private final long seriesTtl;

    public GrafanaQueryService(
            AggregationService aggregationService,
            MetricStore metricStore,
            QueryCacheService cacheService,
            MeterRegistry meterRegistry,
            @Value("${app.cache.ttl.series:300}") long seriesTtl) {
        this.aggregationService = aggregationService;
        this.metricStore = metricStore;
        this.cacheService = cacheService;
        this.meterRegistry = meterRegistry;
        this.seriesTtl = seriesTtl;
    }

    /**
     * Four entries per numeric metric, one per aggregation kind, each with a
     * multi-select category filter over all observed labels.
     */
    @Transactional(readOnly = true)
    public List<MetricOption> listMetrics() {
        List<MetricPayload.PayloadOption> options = metricStore.listCategoryLabels().stream()
                .map(label -> new MetricPayload.PayloadOption(label, label))
                .toList();
        MetricPayload filterPayload = MetricPayload.builder()
                .name(QueryTarget.FILTER_PAYLOAD)
                .label("Filter by category")
                .type("multi-select")
                .placeholder("Select categories to filter (optional)")
                .options(options)
                .build();

        List<MetricOption> metrics = new ArrayList<>();
        for (MetricDefinitionEntity definition : metricStore.listNumericDefinitions()) {
            for (AggregationKind kind : AggregationKind.values()) {
                metrics.add(MetricOption.builder()
                        .label(AggregationService.optionLabel(definition, kind))
                        .value(new TargetKey(definition.getId(), kind).format())
                        .payloads(List.of(filterPayload))
                        .build());
            }
        }
        return metrics;
    }

    @Transactional(readOnly = true, timeout = 10)
    public List<TimeSeriesResult> query(GrafanaQueryRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        TimeRange range = request.getRange();
        if (range == null) {
            throw new IllegalArgumentException("range is required");
        }
        Instant from = range.fromInstant();
        Instant to = range.toInstant();
        Instant dataVersion = metricStore.findDataVersion().orElse(null);

        List<TimeSeriesResult> results = new ArrayList<>();
        for (QueryTarget target : request.getTargets()) {
            if (target == null) {
                continue;
            }
            Optional<TargetKey> key = TargetKey.parse(target.getTarget());
            if (key.isEmpty()) {
                log.debug("Skipping target with unrecognized key: {}", target.getTarget());
                continue;
            }

            List<String> labels = target.resolveFilter();
            TimeSeriesResult series = loadSeries(key.get(), from, to, labels, dataVersion);
            if (!series.isEmpty()) {
                results.add(series);
            }
        }

        sample.stop(Timer.builder("query.latency")
                .tag("type", "timeseries")
                .register(meterRegistry));
        log.info("Query executed: {} targets, {} series returned", request.getTargets().size(), results.size());
        return results;
    }

    /**
     * Occurrences in the range, one annotation each, tagged with their category label.
     */
    @Transactional(readOnly = true)
    public List<Annotation> annotations(AnnotationRequest request) {
        if (request == null || request.getRange() == null) {
            return List.of();
        }
        List<OccurrenceEntity> occurrences = metricStore.findOccurrences(
                request.getRange().fromInstant(), request.getRange().toInstant());
        return occurrences.stream()
                .map(occurrence -> Annotation.builder()
                        .time(occurrence.getStartDate().toEpochMilli())
                        .timeEnd(occurrence.getEndDate() != null ? occurrence.getEndDate().toEpochMilli() : null)
                        .title(occurrence.getName())
                        .text(occurrence.getName())
                        .tags(List.of(occurrence.getName()))
                        .build())
                .toList();
    }

    public List<Map<String, String>> tagKeys() {
        return List.of(Map.of("type", "string", "text", TAG_KEY_CATEGORY));
    }

    @Transactional(readOnly = true)
    public List<Map<String, String>> tagValues(String key) {
        if (!TAG_KEY_CATEGORY.equals(key)) {
            return List.of();
        }
        return metricStore.listCategoryLabels().stream()
                .map(label -> Map.of("text", label))
                .toList();
    }

    private TimeSeriesResult loadSeries(TargetKey key, Instant from, Instant to, List<String> labels, Instant dataVersion) {
        String cacheKey = cacheService.seriesKey(dataVersion, key.format(), from, to, labels);

        Optional<TimeSeriesResult> cached = cacheService.getSeries(cacheKey);
        if (cached.isPresent()) {
            Counter.builder("query.cache")
                    .tag("result", "hit")
                    .register(meterRegistry)
                    .increment();
            return cached.get();
        }

        Counter.builder("query.cache")
                .tag("result", "miss")
                .register(meterRegistry)
                .increment();

        Timer.Sample sample = Timer.start(meterRegistry);
        TimeSeriesResult series = aggregationService.aggregate(key, from, to, labels);
        sample.stop(Timer.builder("query.latency")
                .tag("type", key.kind().getKey())
                .register(meterRegistry));

        cacheService.putSeries(cacheKey, series, seriesTtl);
        return series;
    }
}
