package com.eventfacts.domain.model;

import java.util.Optional;

/**
 * Kind of an upstream metric definition.
 *
 * Only NUMERIC metrics take part in aggregation and discovery.
 */
public enum MetricKind {
    NUMERIC("number"),
    CATEGORICAL("select");

    private final String upstreamType;

    MetricKind(String upstreamType) {
        this.upstreamType = upstreamType;
    }

    public String getUpstreamType() {
        return upstreamType;
    }

    public static Optional<MetricKind> fromUpstreamType(String type) {
        for (MetricKind kind : values()) {
            if (kind.upstreamType.equalsIgnoreCase(type)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
