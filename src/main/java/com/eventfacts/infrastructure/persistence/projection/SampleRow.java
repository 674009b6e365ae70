package com.eventfacts.infrastructure.persistence.projection;

import java.time.Instant;

/**
 * Numeric sample joined with its occurrence start.
 */
public record SampleRow(Double value, Instant startDate) {
}
