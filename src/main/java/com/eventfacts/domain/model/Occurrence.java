package com.eventfacts.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A dated upstream event that samples are attached to.
 */
@Value
@Builder
public class Occurrence {

    long id;
    String name;
    Instant startDate;
    Instant endDate;
    Long calendarId;
}
