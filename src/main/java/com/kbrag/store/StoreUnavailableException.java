package com.kbrag.store;

/**
 * The store could not be reached or refused the credentials. Transport failures and 5xx
 * responses are transient; authentication failures are not.
 */
public class StoreUnavailableException extends VectorStoreException {
    public StoreUnavailableException(String message, boolean transientFailure, Throwable cause) {
        super(message, transientFailure, cause);
    }
}
