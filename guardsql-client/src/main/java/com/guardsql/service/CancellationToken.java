package com.guardsql.service;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cancellation request shared between the interrupt handler and the main loop.
 *
 * <p>The interrupt handler only calls {@link #request()}. Every execution starts a new
 * generation, so a request consumed against an older generation never reaches a newer query.
 */
public class CancellationToken {
    private final AtomicBoolean requested = new AtomicBoolean();
    private final AtomicLong generation = new AtomicLong();

    /**
     * Start a new execution generation and clear any pending request.
     *
     * @return generation number of the new execution
     */
    public long begin() {
        long next = generation.incrementAndGet();
        requested.set(false);
        return next;
    }

    /**
     * Ask for the in-flight execution to stop. Safe to call from a signal handler.
     */
    public void request() {
        requested.set(true);
    }

    public boolean isRequested() {
        return requested.get();
    }

    public long currentGeneration() {
        return generation.get();
    }

    public boolean isCurrent(long gen) {
        return generation.get() == gen;
    }

    /**
     * Take the pending request if it belongs to the given generation.
     *
     * @param gen generation of the execution being polled
     * @return true if a cancel should be issued for that execution
     */
    public boolean consume(long gen) {
        if (!isCurrent(gen)) {
            return false;
        }
        return requested.compareAndSet(true, false);
    }

    public void reset() {
        requested.set(false);
    }
}
