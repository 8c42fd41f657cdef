package com.ithacaweather.ingest.retry;

import com.ithacaweather.core.error.ErrorClass;
import com.ithacaweather.core.error.FetchException;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: {@code baseDelay * 2^(failedAttempts - 1)}, capped at {@code maxDelay},
 * scaled by a random factor in {@code [1 - jitter, 1 + jitter]} and capped again.
 * A provider retry-after hint is honored up to {@code maxRetryAfter}.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double jitter,
        Duration maxRetryAfter
) {
    public static final Duration DEFAULT_MAX_RETRY_AFTER = Duration.ofMinutes(5);
    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(60), 0.2);

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        Objects.requireNonNull(maxRetryAfter, "maxRetryAfter is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1)");
        }
        if (maxRetryAfter.compareTo(maxDelay) < 0) {
            throw new IllegalArgumentException("maxRetryAfter must be >= maxDelay");
        }
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {
        this(maxAttempts, baseDelay, maxDelay, jitter, defaultMaxRetryAfter(maxDelay));
    }

    static Duration defaultMaxRetryAfter(Duration maxDelay) {
        if (maxDelay != null && maxDelay.compareTo(DEFAULT_MAX_RETRY_AFTER) > 0) {
            return maxDelay;
        }
        return DEFAULT_MAX_RETRY_AFTER;
    }

    /**
     * @param failedAttempts attempts made so far, at least 1
     * @param random         uniform sample in [0, 1)
     */
    public Duration backoff(int failedAttempts, double random) {
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        int exponent = Math.min(Math.max(0, failedAttempts - 1), 30);
        long raw = base > (cap >> exponent) ? cap : Math.min(cap, base << exponent);
        double factor = 1 + jitter * (2 * random - 1);
        long jittered = Math.round(raw * factor);
        return Duration.ofMillis(Math.max(0, Math.min(cap, jittered)));
    }

    /**
     * Backoff for the failure, widened to the provider's retry-after hint when that is longer.
     * Never exceeds {@code maxRetryAfter}.
     */
    public Duration delayFor(FetchException failure, int failedAttempts, double random) {
        Duration computed = backoff(failedAttempts, random);
        if (failure.errorClass() == ErrorClass.RATE_LIMITED && failure.retryAfter().isPresent()) {
            Duration hint = failure.retryAfter().get();
            if (hint.compareTo(maxRetryAfter) > 0) {
                return maxRetryAfter;
            }
            return hint.compareTo(computed) > 0 ? hint : computed;
        }
        return computed;
    }

    /**
     * True when the provider asks for a longer wait than this policy is willing to hold a cycle open.
     */
    public boolean exceedsRetryAfterLimit(FetchException failure) {
        return failure.errorClass() == ErrorClass.RATE_LIMITED
                && failure.retryAfter().map(hint -> hint.compareTo(maxRetryAfter) > 0).orElse(false);
    }
}
