package com.eventfacts.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One series of a query response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimeSeriesResult {

    /** Composed, human readable series label. */
    private String target;

    private List<SeriesPoint> datapoints;

    private String unit;

    @JsonIgnore
    public boolean isEmpty() {
        return datapoints == null || datapoints.isEmpty();
    }
}
