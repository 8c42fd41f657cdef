package com.ithacaweather.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One normalized observation for one location. Identity is {@link #key()}; {@code fetchedAt}
 * is audit data only and never participates in equality of stored rows.
 */
public record Reading(
        String locationId,
        Instant observedAt,
        Instant fetchedAt,
        double temperature,
        double feelsLike,
        int humidity,
        double pressure,
        Double visibility,
        double windSpeed,
        Integer windDirection,
        Integer cloudCoverage,
        int conditionCode,
        String conditionMain,
        String conditionDescription,
        Instant sunrise,
        Instant sunset,
        String units,
        String rawPayload
) {
    public Reading {
        Objects.requireNonNull(locationId, "locationId is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        Objects.requireNonNull(sunrise, "sunrise is required");
        Objects.requireNonNull(sunset, "sunset is required");
        Objects.requireNonNull(rawPayload, "rawPayload is required");
        requirePercent("humidity", humidity);
        if (cloudCoverage != null) {
            requirePercent("cloudCoverage", cloudCoverage);
        }
        if (windDirection != null && (windDirection < 0 || windDirection > 359)) {
            throw new IllegalArgumentException("windDirection must be within 0-359: " + windDirection);
        }
    }

    public ReadingKey key() {
        return new ReadingKey(locationId, observedAt);
    }

    private static void requirePercent(String field, int value) {
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException(field + " must be within 0-100: " + value);
        }
    }
}
