package com.eventfacts.domain.exception;

/**
 * Raised to on-demand callers when another sync pass holds the single-flight gate.
 */
public class SyncAlreadyRunningException extends RuntimeException {

    public SyncAlreadyRunningException() {
        super("Sync already in progress");
    }
}
