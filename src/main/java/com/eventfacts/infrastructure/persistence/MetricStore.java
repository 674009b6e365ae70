package com.eventfacts.infrastructure.persistence;

import com.eventfacts.domain.model.IngestionBatch;
import com.eventfacts.domain.model.MetricDefinition;
import com.eventfacts.domain.model.MetricKind;
import com.eventfacts.domain.model.MetricSample;
import com.eventfacts.domain.model.Occurrence;
import com.eventfacts.infrastructure.persistence.entity.MetricDefinitionEntity;
import com.eventfacts.infrastructure.persistence.entity.MetricSampleEntity;
import com.eventfacts.infrastructure.persistence.entity.OccurrenceEntity;
import com.eventfacts.infrastructure.persistence.projection.MonthlyAggregate;
import com.eventfacts.infrastructure.persistence.projection.SampleRow;
import com.eventfacts.infrastructure.persistence.projection.YearlyAggregate;
import com.eventfacts.infrastructure.persistence.repository.MetricDefinitionRepository;
import com.eventfacts.infrastructure.persistence.repository.MetricSampleRepository;
import com.eventfacts.infrastructure.persistence.repository.OccurrenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Local mirror of the upstream facts.
 *
 * Writes are idempotent upserts keyed by upstream identity: writing the same
 * record twice leaves the same row behind. Nothing is ever deleted.
 *
 * Reads take an optional label set; null or empty means "all labels".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricStore {

    private final MetricDefinitionRepository definitionRepository;
    private final OccurrenceRepository occurrenceRepository;
    private final MetricSampleRepository sampleRepository;

    // ---- writes ----

    @Transactional
    public void upsertMetricDefinition(MetricDefinition definition, Instant syncedAt) {
        definitionRepository.save(MetricDefinitionEntity.builder()
                .id(definition.getId())
                .name(definition.getName())
                .translatedName(definition.getTranslatedName())
                .kind(definition.getKind())
                .unit(definition.getUnit())
                .sortKey(definition.getSortKey())
                .updatedAt(syncedAt)
                .build());
    }

    /**
     * Replaces the full definition snapshot in one transaction.
     */
    @Transactional
    public int upsertMetricDefinitions(List<MetricDefinition> definitions, Instant syncedAt) {
        for (MetricDefinition definition : definitions) {
            upsertMetricDefinition(definition, syncedAt);
        }
        return definitions.size();
    }

    @Transactional
    public void upsertOccurrence(Occurrence occurrence, Instant syncedAt) {
        occurrenceRepository.save(OccurrenceEntity.builder()
                .id(occurrence.getId())
                .name(occurrence.getName())
                .startDate(occurrence.getStartDate())
                .endDate(occurrence.getEndDate())
                .calendarId(occurrence.getCalendarId())
                .createdAt(syncedAt)
                .build());
    }

    /**
     * Writes one sample. The numeric and text columns are written together, so
     * a replaced value never leaves the other column behind.
     */
    @Transactional
    public void upsertSample(MetricSample sample, String categoryLabel, Instant syncedAt) {
        sampleRepository.save(MetricSampleEntity.builder()
                .occurrenceId(sample.getOccurrenceId())
                .metricId(sample.getMetricId())
                .numericValue(sample.getNumericValue())
                .textValue(sample.isNumeric() ? null : sample.getTextValue())
                .categoryLabel(categoryLabel)
                .modifiedDate(sample.getModifiedDate())
                .createdAt(syncedAt)
                .build());
    }

    /**
     * Applies occurrences, then samples, in a single transaction. A failure rolls
     * back the whole batch, so the watermark only moves when everything landed.
     */
    @Transactional
    public void applyBatch(IngestionBatch batch, Instant syncedAt) {
        Map<Long, String> labels = new HashMap<>();
        for (Occurrence occurrence : batch.occurrences()) {
            upsertOccurrence(occurrence, syncedAt);
            labels.put(occurrence.getId(), occurrence.getName());
        }
        for (MetricSample sample : batch.samples()) {
            upsertSample(sample, labels.get(sample.getOccurrenceId()), syncedAt);
        }
        log.debug("Applied {} occurrences and {} samples", batch.occurrences().size(), batch.samples().size());
    }

    // ---- reads ----

    @Transactional(readOnly = true)
    public List<MetricDefinitionEntity> listNumericDefinitions() {
        return definitionRepository.findByKindOrderBySortKeyAscIdAsc(MetricKind.NUMERIC);
    }

    @Transactional(readOnly = true)
    public Optional<MetricDefinitionEntity> findDefinition(long metricId) {
        return definitionRepository.findById(metricId);
    }

    @Transactional(readOnly = true)
    public List<String> listCategoryLabels() {
        return sampleRepository.findDistinctCategoryLabels();
    }

    /**
     * Numeric samples with occurrence start in [from, to], ascending by start.
     */
    @Transactional(readOnly = true)
    public List<SampleRow> findNumericSamples(long metricId, Instant from, Instant to, Collection<String> labels) {
        if (isUnfiltered(labels)) {
            return sampleRepository.findNumericSamples(metricId, from, to);
        }
        return sampleRepository.findNumericSamplesLabeled(metricId, from, to, labels);
    }

    @Transactional(readOnly = true)
    public List<MonthlyAggregate> sumByMonth(long metricId, Instant from, Instant to, Collection<String> labels) {
        if (isUnfiltered(labels)) {
            return sampleRepository.sumByMonth(metricId, from, to);
        }
        return sampleRepository.sumByMonthLabeled(metricId, from, to, labels);
    }

    /**
     * Sum, mean and count over calendar year {@code year} in UTC.
     */
    @Transactional(readOnly = true)
    public YearlyAggregate aggregateYear(long metricId, int year, Collection<String> labels) {
        Instant from = LocalDate.of(year, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant until = LocalDate.of(year + 1, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
        YearlyAggregate aggregate = isUnfiltered(labels)
                ? sampleRepository.aggregateYear(metricId, from, until)
                : sampleRepository.aggregateYearLabeled(metricId, from, until, labels);
        return aggregate != null ? aggregate : new YearlyAggregate(null, null, 0L);
    }

    @Transactional(readOnly = true)
    public List<OccurrenceEntity> findOccurrences(Instant from, Instant to) {
        return occurrenceRepository.findByStartDateBetweenOrderByStartDateAscIdAsc(from, to);
    }

    @Transactional(readOnly = true)
    public Optional<Instant> findWatermark() {
        return occurrenceRepository.findWatermark();
    }

    /**
     * Latest write of either occurrences or definitions. Moves on every sync pass
     * that changed anything a series is computed or labelled from.
     */
    @Transactional(readOnly = true)
    public Optional<Instant> findDataVersion() {
        Optional<Instant> occurrences = occurrenceRepository.findWatermark();
        Optional<Instant> definitions = definitionRepository.findLatestUpdate();
        if (occurrences.isEmpty()) {
            return definitions;
        }
        if (definitions.isEmpty()) {
            return occurrences;
        }
        return Optional.of(occurrences.get().isAfter(definitions.get()) ? occurrences.get() : definitions.get());
    }

    private static boolean isUnfiltered(Collection<String> labels) {
        return labels == null || labels.isEmpty();
    }
}
