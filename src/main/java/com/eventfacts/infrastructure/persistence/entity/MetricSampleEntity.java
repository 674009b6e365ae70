package com.eventfacts.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Value of one metric for one occurrence.
 *
 * Indexing Strategy:
 * - metricId for every aggregation query
 * - categoryLabel for filtered queries and the label listing
 * - occurrenceId for the join against occurrences
 *
 * categoryLabel is the occurrence name captured at write time, so filters do
 * not need to join on names.
 */
@Entity
@Table(name = "metric_samples", indexes = {
    @Index(name = "idx_metric_samples_metric_id", columnList = "metricId"),
    @Index(name = "idx_metric_samples_category_label", columnList = "categoryLabel"),
    @Index(name = "idx_metric_samples_occurrence_id", columnList = "occurrenceId")
})
@IdClass(MetricSampleId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSampleEntity {

    @Id
    private Long occurrenceId;

    @Id
    private Long metricId;

    @Column
    private Double numericValue;

    @Column(columnDefinition = "TEXT")
    private String textValue;

    // unbounded but not a LOB, so it stays indexable
    @Column(columnDefinition = "VARCHAR")
    private String categoryLabel;

    @Column
    private Instant modifiedDate;

    @Column(nullable = false)
    private Instant createdAt;
}
