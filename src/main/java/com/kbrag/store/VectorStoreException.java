package com.kbrag.store;

import java.io.IOException;

import com.kbrag.runtime.RetryableFailure;

public class VectorStoreException extends IOException implements RetryableFailure {
    private final boolean transientFailure;

    public VectorStoreException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    @Override
    public boolean isTransient() {
        return transientFailure;
    }
}
