package com.ithacaweather.core.events;

import java.time.Instant;

public record FetchRetryScheduled(
        Instant timestamp,
        String locationId,
        int nextAttempt,
        String errorClass,
        long delayMillis
) implements Event {
    @Override
    public String type() {
        return "FetchRetryScheduled";
    }
}
