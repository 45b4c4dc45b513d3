package com.kbrag.ingest;

import java.io.IOException;

import com.kbrag.runtime.RetryableFailure;

public class EmbeddingProviderException extends IOException implements RetryableFailure {
    private final String provider;
    private final boolean transientFailure;
    private final int attempts;

    public EmbeddingProviderException(String provider, String message, boolean transientFailure, Throwable cause) {
        this(provider, message, transientFailure, 1, cause);
    }

    public EmbeddingProviderException(String provider, String message, boolean transientFailure, int attempts, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.transientFailure = transientFailure;
        this.attempts = attempts;
    }

    public static EmbeddingProviderException exhausted(String provider, int attempts, EmbeddingProviderException last) {
        return new EmbeddingProviderException(
                provider,
                "Embedding provider " + provider + " failed after " + attempts + " attempt(s): " + last.getMessage(),
                last.isTransient(),
                attempts,
                last);
    }

    public String provider() {
        return provider;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public boolean isTransient() {
        return transientFailure;
    }
}
