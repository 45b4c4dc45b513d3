package com.kbrag.runtime;

/**
 * Implemented by provider and store failures so {@link RetryPolicy} can tell a
 * timeout or 5xx apart from a failure that will not go away on its own.
 */
public interface RetryableFailure {
    boolean isTransient();
}
