package com.eventfacts.domain.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide single-flight gate for sync passes.
 *
 * tryAcquire() is an atomic test-and-set: of two concurrent callers exactly one
 * gets true. The holder must call release() when its pass ends.
 */
@Component
public class SyncGate {

    private final AtomicBoolean running = new AtomicBoolean(false);

    public boolean tryAcquire() {
        return running.compareAndSet(false, true);
    }

    public void release() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }
}
