package com.eventfacts.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Value of one metric for one occurrence.
 *
 * Exactly one of numericValue / textValue is set, depending on the JSON type
 * the upstream delivered.
 */
@Value
@Builder
public class MetricSample {

    long occurrenceId;
    long metricId;
    Double numericValue;
    String textValue;
    Instant modifiedDate;

    public boolean isNumeric() {
        return numericValue != null;
    }
}
