package com.eventfacts.domain.exception;

/**
 * Login against the upstream system failed. Fatal for startup and for any sync attempt.
 */
public class UpstreamAuthenticationException extends RuntimeException {

    public UpstreamAuthenticationException(String message) {
        super(message);
    }

    public UpstreamAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
