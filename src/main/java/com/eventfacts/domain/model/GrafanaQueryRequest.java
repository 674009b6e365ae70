package com.eventfacts.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a Grafana JSON datasource {@code /query} call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GrafanaQueryRequest {

    @Builder.Default
    private List<QueryTarget> targets = new ArrayList<>();

    @Valid
    @NotNull
    private TimeRange range;

    private Long intervalMs;
    private Integer maxDataPoints;

    public List<QueryTarget> getTargets() {
        return targets == null ? List.of() : targets;
    }
}
