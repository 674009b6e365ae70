package com.eventfacts.domain.exception;

/**
 * An upstream read failed or returned an unusable response.
 */
public class UpstreamFetchException extends RuntimeException {

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
