package com.eventfacts.domain.model;

import java.util.List;

/**
 * Occurrences of one fetch range together with all samples fetched for them.
 */
public record IngestionBatch(List<Occurrence> occurrences, List<MetricSample> samples) {

    public IngestionBatch {
        occurrences = List.copyOf(occurrences);
        samples = List.copyOf(samples);
    }
}
