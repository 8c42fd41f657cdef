package com.ithacaweather.core.model;

import java.time.Instant;
import java.util.Objects;

public record ReadingKey(String locationId, Instant observedAt) {
    public ReadingKey {
        Objects.requireNonNull(locationId, "locationId is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
    }
}
