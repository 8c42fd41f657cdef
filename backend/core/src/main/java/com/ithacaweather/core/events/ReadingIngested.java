package com.ithacaweather.core.events;

import java.time.Instant;

public record ReadingIngested(
        Instant timestamp,
        String locationId,
        Instant observedAt,
        double temperature,
        String conditions
) implements Event {
    @Override
    public String type() {
        return "ReadingIngested";
    }
}
