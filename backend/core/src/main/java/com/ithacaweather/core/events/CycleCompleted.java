package com.ithacaweather.core.events;

import java.time.Instant;

public record CycleCompleted(
        Instant timestamp,
        long cycle,
        int succeeded,
        int failed,
        int deferred,
        int inserted,
        int skippedDuplicate,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CycleCompleted";
    }
}
