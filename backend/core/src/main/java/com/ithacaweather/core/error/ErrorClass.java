package com.ithacaweather.core.error;

public enum ErrorClass {
    TRANSIENT(true),
    RATE_LIMITED(true),
    CLIENT_ERROR(false),
    MALFORMED(false),
    QUOTA_EXCEEDED(false),
    RETRIES_EXHAUSTED(false),
    STORAGE_FAILURE(false);

    private final boolean retryable;

    ErrorClass(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
