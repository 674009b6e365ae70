package com.eventfacts.domain.model;

import java.util.Optional;

/**
 * The four series kinds a metric can be queried as.
 *
 * The key is the suffix used in composite target keys, the label is the
 * human readable part of series names.
 */
public enum AggregationKind {
    RAW("raw", "Raw Data"),
    MONTHLY("monthly", "Monthly Sum"),
    YEARLY_SUM("yearly_sum", "Yearly Sum"),
    YEARLY_MEAN("yearly_mean", "Yearly Mean");

    private final String key;
    private final String label;

    AggregationKind(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<AggregationKind> fromKey(String key) {
        for (AggregationKind kind : values()) {
            if (kind.key.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
