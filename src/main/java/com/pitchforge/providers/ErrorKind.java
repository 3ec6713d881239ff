package com.pitchforge.providers;

/**
 * Shared failure taxonomy of every provider adapter.
 */
public enum ErrorKind {
    MODEL_NOT_FOUND(true),
    RATE_LIMITED(true),
    AUTH_INVALID(false),
    TRANSIENT(false);

    private final boolean retriesInProvider;

    ErrorKind(boolean retriesInProvider) {
        this.retriesInProvider = retriesInProvider;
    }

    /** Whether one retry with an alternate model of the same provider is worth making. */
    public boolean retriesInProvider() {
        return retriesInProvider;
    }
}
