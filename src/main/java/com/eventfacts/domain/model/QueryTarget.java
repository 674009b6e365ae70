package com.eventfacts.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One target of a query request.
 *
 * The category filter is read from {@code filter} or, as the Grafana plugin
 * sends it, from the {@code payload} entry named after the discovery payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryTarget {

    public static final String FILTER_PAYLOAD = "category filter";

    private String target;
    private String refId;
    private String type;
    private List<String> filter;
    private Map<String, Object> payload;

    /**
     * Category labels to filter on, de-duplicated in first-seen order. Empty means no filter.
     */
    public List<String> resolveFilter() {
        Set<String> labels = new LinkedHashSet<>();
        if (filter != null) {
            addLabels(labels, filter);
        }
        if (payload != null) {
            Object fromPayload = payload.get(FILTER_PAYLOAD);
            if (fromPayload instanceof Collection<?> values) {
                addLabels(labels, values);
            } else if (fromPayload instanceof String single) {
                addLabels(labels, List.of(single));
            }
        }
        return new ArrayList<>(labels);
    }

    private static void addLabels(Set<String> labels, Collection<?> values) {
        for (Object value : values) {
            if (value != null && !value.toString().isBlank()) {
                labels.add(value.toString());
            }
        }
    }
}
