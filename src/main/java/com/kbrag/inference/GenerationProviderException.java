package com.kbrag.inference;

import java.io.IOException;
import java.util.Locale;

import com.kbrag.runtime.RetryableFailure;

public class GenerationProviderException extends IOException implements RetryableFailure {
    public enum Kind {
        AUTHENTICATION,
        RATE_LIMIT,
        TIMEOUT,
        NETWORK,
        SERVER,
        INVALID_RESPONSE
    }

    private final String provider;
    private final Kind kind;

    public GenerationProviderException(String provider, Kind kind, String message) {
        this(provider, kind, message, null);
    }

    public GenerationProviderException(String provider, Kind kind, String message, Throwable cause) {
        super(provider + " " + kind.name().toLowerCase(Locale.ROOT) + ": " + message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public String provider() {
        return provider;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public boolean isTransient() {
        return kind == Kind.RATE_LIMIT || kind == Kind.TIMEOUT || kind == Kind.NETWORK || kind == Kind.SERVER;
    }
}
