package com.eventfacts.infrastructure.upstream;

import com.eventfacts.domain.model.DateRange;
import com.eventfacts.domain.model.MetricDefinition;
import com.eventfacts.domain.model.MetricSample;
import com.eventfacts.domain.model.Occurrence;

import java.util.List;

/**
 * Read-only view of the upstream event-management system.
 *
 * Implementations hold their own session state. Every fetch throws
 * {@link com.eventfacts.domain.exception.UpstreamFetchException} on failure and
 * {@link com.eventfacts.domain.exception.UpstreamAuthenticationException} when
 * no session can be established.
 */
public interface UpstreamClient {

    void authenticate();

    boolean isAuthenticated();

    List<MetricDefinition> fetchMetricDefinitions();

    /**
     * Occurrences whose start date lies in the inclusive range.
     */
    List<Occurrence> fetchOccurrences(DateRange range);

    List<MetricSample> fetchSamples(long occurrenceId);
}
