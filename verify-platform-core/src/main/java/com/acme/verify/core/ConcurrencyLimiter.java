package com.acme.verify.core;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admission control for a downstream dependency: at most {@code limit} holders at any instant.
 * Callers that cannot obtain a permit are turned away rather than queued in memory, so excess work
 * waits where it came from (the queue, the transport) instead of piling up here.
 */
public class ConcurrencyLimiter {
    private final String name;
    private final int limit;
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    public ConcurrencyLimiter(String name, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException(name + " limit must be at least 1, was " + limit);
        }
        this.name = name;
        this.limit = limit;
        this.permits = new Semaphore(limit, true);
    }

    /** Non-blocking acquire. */
    public boolean tryAcquire() {
        if (!permits.tryAcquire()) {
            return false;
        }
        onAcquired();
        return true;
    }

    /**
     * Waits up to {@code wait} for a permit.
     *
     * @throws OverloadedException if no permit became available in time
     */
    public void acquire(Duration wait) {
        boolean acquired;
        try {
            acquired = permits.tryAcquire(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OverloadedException(name + " admission interrupted", e);
        }
        if (!acquired) {
            throw new OverloadedException(name + " concurrency ceiling of " + limit + " reached");
        }
        onAcquired();
    }

    public void release() {
        inFlight.decrementAndGet();
        permits.release();
    }

    private void onAcquired() {
        int now = inFlight.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
    }

    public int available() {
        return permits.availablePermits();
    }

    public int inFlight() {
        return inFlight.get();
    }

    /** Highest number of simultaneous holders observed since construction. */
    public int peakInFlight() {
        return peak.get();
    }

    public int limit() {
        return limit;
    }

    public String name() {
        return name;
    }
}
