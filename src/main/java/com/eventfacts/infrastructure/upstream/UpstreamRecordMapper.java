package com.eventfacts.infrastructure.upstream;

import com.eventfacts.domain.model.MetricDefinition;
import com.eventfacts.domain.model.MetricKind;
import com.eventfacts.domain.model.MetricSample;
import com.eventfacts.domain.model.Occurrence;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Converts loosely typed upstream JSON into domain records.
 *
 * A record missing a required field is skipped with a warning; nothing
 * half-populated leaves this class. Timestamps without an offset are read as UTC.
 */
@Slf4j
@Component
public class UpstreamRecordMapper {

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    public List<MetricDefinition> toMetricDefinitions(JsonNode facts) {
        List<MetricDefinition> result = new ArrayList<>();
        for (JsonNode node : elements(facts, "facts")) {
            Optional<Long> id = longValue(node, "id");
            String name = text(node, "name");
            Optional<MetricKind> kind = MetricKind.fromUpstreamType(text(node, "type"));
            if (id.isEmpty() || name == null || kind.isEmpty()) {
                log.warn("Skipping malformed metric definition: {}", node);
                continue;
            }
            String translated = text(node, "nameTranslated");
            result.add(MetricDefinition.builder()
                    .id(id.get())
                    .name(name)
                    .translatedName(translated != null ? translated : name)
                    .kind(kind.get())
                    .unit(text(node, "unit"))
                    .sortKey(longValue(node, "sortKey").map(Long::intValue).orElse(0))
                    .build());
        }
        return result;
    }

    public List<Occurrence> toOccurrences(JsonNode events) {
        List<Occurrence> result = new ArrayList<>();
        for (JsonNode node : elements(events, "events")) {
            Optional<Long> id = longValue(node, "id");
            String name = text(node, "name");
            Instant start = parseTimestamp(text(node, "startDate"));
            if (id.isEmpty() || name == null || start == null) {
                log.warn("Skipping malformed occurrence: {}", node);
                continue;
            }
            result.add(Occurrence.builder()
                    .id(id.get())
                    .name(name)
                    .startDate(start)
                    .endDate(parseTimestamp(text(node, "endDate")))
                    .calendarId(calendarId(node).orElse(null))
                    .build());
        }
        return result;
    }

    /**
     * @param occurrenceId used when a record omits its own eventId
     */
    public List<MetricSample> toSamples(JsonNode facts, long occurrenceId) {
        List<MetricSample> result = new ArrayList<>();
        for (JsonNode node : elements(facts, "facts of event " + occurrenceId)) {
            Optional<Long> metricId = longValue(node, "factId");
            JsonNode value = node.get("value");
            if (metricId.isEmpty() || value == null || !(value.isNumber() || value.isTextual())) {
                log.warn("Skipping malformed sample of occurrence {}: {}", occurrenceId, node);
                continue;
            }
            result.add(MetricSample.builder()
                    .occurrenceId(longValue(node, "eventId").orElse(occurrenceId))
                    .metricId(metricId.get())
                    .numericValue(value.isNumber() ? value.doubleValue() : null)
                    .textValue(value.isTextual() ? value.textValue() : null)
                    .modifiedDate(parseTimestamp(text(node, "modifiedDate")))
                    .build());
        }
        return result;
    }

    private static Iterable<JsonNode> elements(JsonNode array, String what) {
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            log.warn("Expected an array of {} but got {}", what, array.getNodeType());
            return List.of();
        }
        return array;
    }

    private static Optional<Long> calendarId(JsonNode node) {
        Optional<Long> direct = longValue(node, "calendarId");
        if (direct.isPresent()) {
            return direct;
        }
        JsonNode calendar = node.get("calendar");
        return calendar != null && calendar.isObject() ? longValue(calendar, "id") : Optional.empty();
    }

    private static Optional<Long> longValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.canConvertToLong() && value.isIntegralNumber()) {
            return Optional.of(value.longValue());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Long.parseLong(value.textValue().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace(' ', 'T');
        DateTimeParseException failure = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(normalized);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        log.warn("Unparsable upstream timestamp {}: {}", value, failure.getMessage());
        return null;
    }
}
