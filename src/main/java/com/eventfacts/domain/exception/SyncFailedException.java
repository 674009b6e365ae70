package com.eventfacts.domain.exception;

/**
 * A sync pass aborted. The cause carries the fetch or store failure.
 */
public class SyncFailedException extends RuntimeException {

    public SyncFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
