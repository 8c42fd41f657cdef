package com.ithacaweather.core.error;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FetchExceptionTest {
    @Test
    void onlyTransientAndRateLimitedAreRetryable() {
        for (ErrorClass errorClass : ErrorClass.values()) {
            boolean expected = errorClass == ErrorClass.TRANSIENT || errorClass == ErrorClass.RATE_LIMITED;
            assertEquals(expected, errorClass.retryable(), errorClass.name());
        }
    }

    @Test
    void retriesExhaustedKeepsLastFailureAsCause() {
        FetchException last = new FetchException(ErrorClass.RATE_LIMITED, "downtown", "HTTP 429", 429,
                Duration.ofSeconds(30), null);

        FetchException exhausted = FetchException.retriesExhausted(last, 3);

        assertEquals(ErrorClass.RETRIES_EXHAUSTED, exhausted.errorClass());
        assertEquals(ErrorClass.RATE_LIMITED, exhausted.lastErrorClass());
        assertEquals("downtown", exhausted.locationId());
        assertEquals(429, exhausted.statusCode().orElseThrow());
        assertTrue(exhausted.retryAfter().isEmpty());
        assertSame(last, exhausted.getCause());
        assertTrue(exhausted.getMessage().contains("3 attempts"));
    }

    @Test
    void lastErrorClassOfPlainFailureIsItsOwnClass() {
        FetchException malformed = new FetchException(ErrorClass.MALFORMED, "cayuga-lake", "missing main.temp");

        assertEquals(ErrorClass.MALFORMED, malformed.lastErrorClass());
        assertFalse(malformed.statusCode().isPresent());
        assertEquals(ErrorClass.STORAGE_FAILURE, new StorageException("disk full", null).errorClass());
    }
}
