package com.ithacaweather.core.events;

import java.time.Instant;

public record CycleStarted(
        Instant timestamp,
        long cycle,
        int scheduledLocations,
        int deferredLocations
) implements Event {
    @Override
    public String type() {
        return "CycleStarted";
    }
}
