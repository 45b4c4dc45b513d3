package com.kbrag.runtime;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this(maxAttempts, initialBackoff, maxBackoff, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new ConfigurationException("retry maxAttempts must be >= 1 but was " + maxAttempts);
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new ConfigurationException("retry backoff must be >= 0");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoff.toMillis();
        this.maxBackoffMs = Math.max(initialBackoffMs, maxBackoff.toMillis());
        this.sleeper = sleeper;
    }

    public static RetryPolicy fromConfig(AppConfig.RetryConfig config) {
        return new RetryPolicy(
                config.getMaxAttempts(),
                Duration.ofMillis(config.getInitialBackoffMs()),
                Duration.ofMillis(config.getMaxBackoffMs()));
    }

    public static RetryPolicy noRetries() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(String operation, ThrowingSupplier<T> supplier) throws IOException {
        return execute(operation, Deadline.none(), supplier);
    }

    /**
     * Runs {@code supplier} until it succeeds, throws a non-transient failure, runs out of
     * attempts or the deadline passes. The last failure is rethrown unchanged.
     */
    public <T> T execute(String operation, Deadline deadline, ThrowingSupplier<T> supplier) throws IOException {
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return supplier.get(attempt);
            } catch (IOException e) {
                last = e;
                if (!isTransient(e) || attempt == maxAttempts) {
                    break;
                }
                long backoff = backoffMillis(attempt);
                if (backoff >= deadline.remainingMillis()) {
                    log.warn("retry.abandoned operation={} attempt={} reason=deadline", operation, attempt);
                    break;
                }
                log.warn("retry.scheduled operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, backoff, e.getMessage());
                pause(operation, backoff);
            }
        }
        throw last;
    }

    long backoffMillis(int attempt) {
        long backoff = initialBackoffMs;
        for (int i = 1; i < attempt && backoff < maxBackoffMs; i++) {
            backoff *= 2;
        }
        return Math.min(backoff, maxBackoffMs);
    }

    private void pause(String operation, long backoffMs) throws InterruptedIOException {
        if (backoffMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while backing off " + operation);
        }
    }

    private static boolean isTransient(IOException e) {
        if (e instanceof InterruptedIOException && !(e instanceof java.net.SocketTimeoutException)) {
            return false;
        }
        if (e instanceof RetryableFailure failure) {
            return failure.isTransient();
        }
        return true;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T> {
        T get(int attempt) throws IOException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
