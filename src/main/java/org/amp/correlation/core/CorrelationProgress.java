package org.amp.correlation.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic progress counter shared between correlation workers and an observer.
 *
 * <p>Workers advance it once per finished address; observers read it at any time without
 * blocking the computation. A dual-dataset run counts every address twice.</p>
 */
public final class CorrelationProgress {
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong total = new AtomicLong();

    /**
     * Adds {@code units} of expected work to the total.
     */
    public void expect(long units) {
        if (units < 0L) {
            throw new IllegalArgumentException("units must be >= 0, got " + units);
        }
        total.addAndGet(units);
    }

    void advance() {
        completed.incrementAndGet();
    }

    public long completed() {
        return completed.get();
    }

    public long total() {
        return total.get();
    }

    /**
     * Completed share in {@code [0, 1]}; {@code 0} before any work is expected.
     */
    public double fraction() {
        long expected = total.get();
        if (expected <= 0L) {
            return 0.0d;
        }
        return Math.min(1.0d, (double) completed.get() / (double) expected);
    }

    public boolean isDone() {
        long expected = total.get();
        return expected > 0L && completed.get() >= expected;
    }

    @Override
    public String toString() {
        return "CorrelationProgress[" + completed.get() + "/" + total.get() + "]";
    }
}
