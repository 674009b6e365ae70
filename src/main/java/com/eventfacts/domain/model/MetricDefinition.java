package com.eventfacts.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Metric definition as delivered by the upstream master data.
 */
@Value
@Builder
public class MetricDefinition {

    long id;
    String name;
    String translatedName;
    MetricKind kind;
    String unit;
    int sortKey;

    public boolean isNumeric() {
        return kind == MetricKind.NUMERIC;
    }
}
