package com.eventfacts.domain.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;

/**
 * Inclusive calendar date range used to select upstream occurrences by start date.
 */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range end " + to + " is before start " + from);
        }
    }

    public static DateRange ofYear(int year) {
        return new DateRange(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    /**
     * Previous, current and next calendar month around the given day.
     */
    public static DateRange rollingWindow(LocalDate today) {
        YearMonth current = YearMonth.from(today);
        return new DateRange(current.minusMonths(1).atDay(1), current.plusMonths(1).atEndOfMonth());
    }

    @Override
    public String toString() {
        return from + ".." + to;
    }
}
