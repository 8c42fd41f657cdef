package com.ithacaweather.core.error;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Failure of a single logical fetch for one location, classified so that callers can decide
 * whether retrying can help.
 */
public class FetchException extends Exception {
    private final ErrorClass errorClass;
    private final String locationId;
    private final Integer statusCode;
    private final Duration retryAfter;

    public FetchException(ErrorClass errorClass, String locationId, String message) {
        this(errorClass, locationId, message, null, null, null);
    }

    public FetchException(ErrorClass errorClass, String locationId, String message, Throwable cause) {
        this(errorClass, locationId, message, null, null, cause);
    }

    public FetchException(
            ErrorClass errorClass,
            String locationId,
            String message,
            Integer statusCode,
            Duration retryAfter,
            Throwable cause
    ) {
        super(message, cause);
        this.errorClass = Objects.requireNonNull(errorClass, "errorClass is required");
        this.locationId = locationId;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public static FetchException retriesExhausted(FetchException last, int attempts) {
        return new FetchException(
                ErrorClass.RETRIES_EXHAUSTED,
                last.locationId(),
                "Gave up after " + attempts + " attempts: " + last.getMessage(),
                last.statusCode().orElse(null),
                null,
                last
        );
    }

    public ErrorClass errorClass() {
        return errorClass;
    }

    public String locationId() {
        return locationId;
    }

    public Optional<Integer> statusCode() {
        return Optional.ofNullable(statusCode);
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /**
     * Class of the underlying failure; for {@code RETRIES_EXHAUSTED} this is the class of the
     * final attempt, otherwise the class of this exception.
     */
    public ErrorClass lastErrorClass() {
        if (errorClass == ErrorClass.RETRIES_EXHAUSTED && getCause() instanceof FetchException last) {
            return last.errorClass();
        }
        return errorClass;
    }
}
