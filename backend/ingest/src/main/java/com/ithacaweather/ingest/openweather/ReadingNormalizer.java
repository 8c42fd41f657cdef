package com.ithacaweather.ingest.openweather;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.ithacaweather.core.error.ErrorClass;
import com.ithacaweather.core.error.FetchException;
import com.ithacaweather.core.model.Location;
import com.ithacaweather.core.model.Reading;
import com.ithacaweather.core.util.JsonUtils;

import java.time.DateTimeException;
import java.time.Instant;

/**
 * Maps an OpenWeather "current weather" body onto {@link Reading}. Fields the mapping does not
 * name are ignored; a missing required field fails the whole reading as {@code MALFORMED}.
 */
public final class ReadingNormalizer {
    // Timestamps must survive conversion to epoch milliseconds in storage.
    static final long MAX_EPOCH_SECOND = Long.MAX_VALUE / 1000;

    private final String units;

    public ReadingNormalizer(String units) {
        this.units = units;
    }

    public Reading normalize(Location location, String body, Instant fetchedAt) throws FetchException {
        JsonNode root;
        try {
            root = JsonUtils.readTree(body);
        } catch (JsonProcessingException e) {
            throw malformed(location, "Response body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw malformed(location, "Response body is not a JSON object", null);
        }

        JsonNode main = root.path("main");
        JsonNode wind = root.path("wind");
        JsonNode sys = root.path("sys");
        JsonNode weatherArray = root.path("weather");
        if (!weatherArray.isArray() || weatherArray.isEmpty()) {
            throw malformed(location, "Missing required field weather[0]", null);
        }
        JsonNode weather = weatherArray.get(0);

        try {
            return new Reading(
                    location.id(),
                    epochSeconds(location, root, "dt"),
                    fetchedAt,
                    requiredDouble(location, main, "main.temp", "temp"),
                    requiredDouble(location, main, "main.feels_like", "feels_like"),
                    requiredInt(location, main, "main.humidity", "humidity"),
                    requiredDouble(location, main, "main.pressure", "pressure"),
                    optionalDouble(root.path("visibility")),
                    requiredDouble(location, wind, "wind.speed", "speed"),
                    windDirection(wind.path("deg")),
                    optionalInt(root.path("clouds").path("all")),
                    requiredInt(location, weather, "weather[0].id", "id"),
                    optionalText(weather.path("main")),
                    optionalText(weather.path("description")),
                    epochSeconds(location, sys, "sunrise"),
                    epochSeconds(location, sys, "sunset"),
                    units,
                    body
            );
        } catch (IllegalArgumentException | DateTimeException e) {
            throw malformed(location, "Reading out of range: " + e.getMessage(), e);
        }
    }

    private static Instant epochSeconds(Location location, JsonNode parent, String field) throws FetchException {
        JsonNode node = parent.path(field);
        if (!node.isNumber()) {
            throw malformed(location, "Missing required field " + field, null);
        }
        if (!node.canConvertToLong() || Math.abs(node.asLong()) > MAX_EPOCH_SECOND) {
            throw malformed(location, "Timestamp out of range in " + field + ": " + node.asText(), null);
        }
        return Instant.ofEpochSecond(node.asLong());
    }

    private static double requiredDouble(Location location, JsonNode parent, String path, String field)
            throws FetchException {
        JsonNode node = parent.path(field);
        if (!node.isNumber()) {
            throw malformed(location, "Missing required field " + path, null);
        }
        return node.asDouble();
    }

    private static int requiredInt(Location location, JsonNode parent, String path, String field)
            throws FetchException {
        JsonNode node = parent.path(field);
        if (!node.isNumber()) {
            throw malformed(location, "Missing required field " + path, null);
        }
        return (int) Math.round(node.asDouble());
    }

    private static Double optionalDouble(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }

    private static Integer optionalInt(JsonNode node) {
        return node.isNumber() ? (int) Math.round(node.asDouble()) : null;
    }

    private static Integer windDirection(JsonNode node) {
        if (!node.isNumber()) {
            return null;
        }
        return Math.floorMod((int) Math.round(node.asDouble()), 360);
    }

    private static String optionalText(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }

    private static FetchException malformed(Location location, String message, Throwable cause) {
        return new FetchException(ErrorClass.MALFORMED, location.id(), message + " for " + location.id(), cause);
    }
}
