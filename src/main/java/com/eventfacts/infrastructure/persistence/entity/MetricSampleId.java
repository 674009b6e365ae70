package com.eventfacts.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite identity of a sample. Being the primary key, it is also the
 * uniqueness constraint on (occurrence, metric).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricSampleId implements Serializable {

    private Long occurrenceId;
    private Long metricId;
}
