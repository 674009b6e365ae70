package com.eventfacts.api;

import java.time.Instant;

/** Structured error payload returned for rejected requests. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {}
