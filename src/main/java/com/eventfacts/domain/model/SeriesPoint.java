package com.eventfacts.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One datapoint, serialized the way Grafana expects it: {@code [value, epochMillis]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"value", "timestamp"})
public record SeriesPoint(double value, long timestamp) {
}
