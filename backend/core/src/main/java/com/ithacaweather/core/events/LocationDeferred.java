package com.ithacaweather.core.events;

import java.time.Instant;

public record LocationDeferred(
        Instant timestamp,
        long cycle,
        String locationId,
        int quotaRemaining
) implements Event {
    @Override
    public String type() {
        return "LocationDeferred";
    }
}
