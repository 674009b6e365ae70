package com.eventfacts.domain.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Composite target key {@code fact_<metricId>_<aggregationKind>} addressing one series.
 */
public record TargetKey(long metricId, AggregationKind kind) {

    public static final String PREFIX = "fact";

    private static final Pattern PATTERN =
            Pattern.compile("^" + PREFIX + "_(\\d+)_(raw|monthly|yearly_sum|yearly_mean)$");

    /**
     * Parses a composite key. Anything that does not match the exact pattern yields empty.
     */
    public static Optional<TargetKey> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = PATTERN.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        long metricId;
        try {
            metricId = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            // digits beyond the long range
            return Optional.empty();
        }
        return AggregationKind.fromKey(matcher.group(2)).map(kind -> new TargetKey(metricId, kind));
    }

    public String format() {
        return PREFIX + "_" + metricId + "_" + kind.getKey();
    }
}
