package com.eventfacts.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Discovery entry: one selectable series with its payload editors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricOption {

    private String label;
    private String value;
    private List<MetricPayload> payloads;
}
