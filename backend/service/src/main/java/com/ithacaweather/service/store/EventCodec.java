package com.ithacaweather.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ithacaweather.core.events.AlertRaised;
import com.ithacaweather.core.events.CycleCompleted;
import com.ithacaweather.core.events.CycleFailed;
import com.ithacaweather.core.events.CycleStarted;
import com.ithacaweather.core.events.Event;
import com.ithacaweather.core.events.FetchRetryScheduled;
import com.ithacaweather.core.events.LocationDeferred;
import com.ithacaweather.core.events.ReadingIngested;
import com.ithacaweather.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "CycleStarted", CycleStarted.class,
            "CycleCompleted", CycleCompleted.class,
            "CycleFailed", CycleFailed.class,
            "ReadingIngested", ReadingIngested.class,
            "LocationDeferred", LocationDeferred.class,
            "FetchRetryScheduled", FetchRetryScheduled.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static boolean isKnownType(String type) {
        return TYPES.containsKey(type);
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
