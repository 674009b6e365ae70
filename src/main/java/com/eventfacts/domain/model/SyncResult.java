package com.eventfacts.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one completed sync pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {

    private String type;
    private int metricDefinitions;
    private int occurrences;
    private int samples;
    private Instant completedAt;
    private long durationMs;
}
