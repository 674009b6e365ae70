package com.eventfacts.domain.service;

import com.eventfacts.domain.model.AggregationKind;
import com.eventfacts.domain.model.SeriesPoint;
import com.eventfacts.domain.model.TargetKey;
import com.eventfacts.domain.model.TimeSeriesResult;
import com.eventfacts.infrastructure.persistence.MetricStore;
import com.eventfacts.infrastructure.persistence.entity.MetricDefinitionEntity;
import com.eventfacts.infrastructure.persistence.projection.YearlyAggregate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns stored samples into series.
 *
 * Only numeric samples count. Calendar buckets (months, years) are UTC and
 * each point is stamped with the first instant of its bucket.
 *
 * - RAW: every sample in [from, to], ascending by occurrence start
 * - MONTHLY: sum per month, inclusive range bounds
 * - YEARLY_SUM / YEARLY_MEAN: every year touched by [from, to], aggregated
 *   over the whole year; years without samples produce no point
 */
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final MetricStore metricStore;

    @Transactional(readOnly = true)
    public TimeSeriesResult aggregate(TargetKey key, Instant from, Instant to, List<String> labels) {
        Optional<MetricDefinitionEntity> definition = metricStore.findDefinition(key.metricId());
        List<SeriesPoint> points = from.isAfter(to)
                ? List.of()
                : switch (key.kind()) {
                    case RAW -> raw(key.metricId(), from, to, labels);
                    case MONTHLY -> monthly(key.metricId(), from, to, labels);
                    case YEARLY_SUM -> yearly(key.metricId(), from, to, labels, false);
                    case YEARLY_MEAN -> yearly(key.metricId(), from, to, labels, true);
                };

        return TimeSeriesResult.builder()
                .target(seriesLabel(definition.orElse(null), key, labels))
                .datapoints(points)
                .unit(definition.map(MetricDefinitionEntity::getUnit).filter(unit -> !unit.isBlank()).orElse(null))
                .build();
    }

    private List<SeriesPoint> raw(long metricId, Instant from, Instant to, List<String> labels) {
        return metricStore.findNumericSamples(metricId, from, to, labels).stream()
                .map(row -> new SeriesPoint(row.value(), row.startDate().toEpochMilli()))
                .toList();
    }

    private List<SeriesPoint> monthly(long metricId, Instant from, Instant to, List<String> labels) {
        return metricStore.sumByMonth(metricId, from, to, labels).stream()
                .map(month -> new SeriesPoint(
                        month.sum(),
                        YearMonth.of(month.year(), month.month()).atDay(1)
                                .atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli()))
                .toList();
    }

    private List<SeriesPoint> yearly(long metricId, Instant from, Instant to, List<String> labels, boolean mean) {
        int startYear = from.atZone(ZoneOffset.UTC).getYear();
        int endYear = to.atZone(ZoneOffset.UTC).getYear();

        List<SeriesPoint> points = new ArrayList<>();
        for (int year = startYear; year <= endYear; year++) {
            YearlyAggregate aggregate = metricStore.aggregateYear(metricId, year, labels);
            if (!aggregate.hasSamples()) {
                continue;
            }
            long timestamp = LocalDate.of(year, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
            points.add(new SeriesPoint(mean ? aggregate.mean() : aggregate.sum(), timestamp));
        }
        return points;
    }

    /**
     * {@code <name> - <kind>[ (<unit>)][ [<label>, ...]]}
     */
    static String seriesLabel(MetricDefinitionEntity definition, TargetKey key, List<String> labels) {
        String name = definition != null ? definition.getDisplayName() : "Metric " + key.metricId();
        StringBuilder label = new StringBuilder(name)
                .append(" - ")
                .append(key.kind().getLabel());
        if (definition != null && definition.getUnit() != null && !definition.getUnit().isBlank()) {
            label.append(" (").append(definition.getUnit()).append(")");
        }
        if (labels != null && !labels.isEmpty()) {
            label.append(" [").append(String.join(", ", labels)).append("]");
        }
        return label.toString();
    }

    /**
     * Discovery label: {@code <name>[ (<unit>)] - <kind>}.
     */
    static String optionLabel(MetricDefinitionEntity definition, AggregationKind kind) {
        String name = definition.getDisplayName();
        if (definition.getUnit() != null && !definition.getUnit().isBlank()) {
            name += " (" + definition.getUnit() + ")";
        }
        return name + " - " + kind.getLabel();
    }
}
