package com.ithacaweather.ingest.retry;

import com.ithacaweather.core.error.FetchException;
import com.ithacaweather.core.model.Location;

import java.time.Instant;

/**
 * In-flight state of one logical fetch. {@code attempt} is 1-based and names the attempt that is
 * running or about to run.
 */
public record FetchAttempt(Location location, int attempt, FetchException lastError, Instant nextRetryAt) {
    public static FetchAttempt first(Location location) {
        return new FetchAttempt(location, 1, null, null);
    }

    public FetchAttempt failed(FetchException error) {
        return new FetchAttempt(location, attempt, error, null);
    }

    public FetchAttempt retryAt(Instant at) {
        return new FetchAttempt(location, attempt + 1, lastError, at);
    }
}
