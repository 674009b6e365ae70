package com.eventfacts.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 time range shared by all targets of a request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimeRange {

    @NotBlank
    private String from;

    @NotBlank
    private String to;

    public Instant fromInstant() {
        return parse(from, "from");
    }

    public Instant toInstant() {
        return parse(to, "to");
    }

    private static Instant parse(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("range." + field + " is required");
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("range." + field + " is not an ISO-8601 timestamp: " + value, e);
        }
    }
}
