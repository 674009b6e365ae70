package com.eventfacts.infrastructure.persistence.projection;

/**
 * Sum, mean and sample count of one metric over one calendar year (UTC).
 * Sum and mean are null when count is zero.
 */
public record YearlyAggregate(Double sum, Double mean, Long count) {

    public boolean hasSamples() {
        return count != null && count > 0;
    }
}
