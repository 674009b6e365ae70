package com.eventfacts.infrastructure.persistence.projection;

/**
 * Sum of one metric over one calendar month (UTC).
 */
public record MonthlyAggregate(Integer year, Integer month, Double sum, Long count) {
}
