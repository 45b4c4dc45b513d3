package com.kbrag.runtime;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Caller-supplied time budget. Elapsed time is measured as a difference of
 * {@link System#nanoTime()} readings, never by comparing absolute values.
 */
public final class Deadline {
    private static final Deadline NONE = new Deadline(System::nanoTime, 0L, -1L);

    private final LongSupplier clock;
    private final long startNanos;
    private final long budgetNanos;

    private Deadline(LongSupplier clock, long startNanos, long budgetNanos) {
        this.clock = clock;
        this.startNanos = startNanos;
        this.budgetNanos = budgetNanos;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration timeout) {
        return after(timeout, System::nanoTime);
    }

    static Deadline after(Duration timeout, LongSupplier clock) {
        if (timeout == null) {
            return NONE;
        }
        long budget;
        try {
            budget = Math.max(0L, timeout.toNanos());
        } catch (ArithmeticException e) {
            return NONE;
        }
        return new Deadline(clock, clock.getAsLong(), budget);
    }

    public boolean isUnbounded() {
        return budgetNanos < 0;
    }

    public boolean isExpired() {
        return !isUnbounded() && elapsedNanos() >= budgetNanos;
    }

    public long remainingMillis() {
        if (isUnbounded()) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, (budgetNanos - elapsedNanos()) / 1_000_000L);
    }

    private long elapsedNanos() {
        return clock.getAsLong() - startNanos;
    }

    @Override
    public String toString() {
        return isUnbounded() ? "Deadline[none]" : "Deadline[remainingMs=" + remainingMillis() + "]";
    }
}
