package com.ithacaweather.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

public record Location(
        String id,
        String name,
        double latitude,
        double longitude,
        String description
) {
    private static final Pattern ID_PATTERN = Pattern.compile("[a-z0-9][a-z0-9-]*");

    public Location {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        if (!ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("Location id must be lowercase kebab-case: " + id);
        }
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude out of range for " + id + ": " + latitude);
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude out of range for " + id + ": " + longitude);
        }
    }
}
