package com.ithacaweather.service.api;

import com.ithacaweather.core.bus.EventBus;
import com.ithacaweather.core.events.AlertRaised;
import com.ithacaweather.core.events.LocationDeferred;
import com.ithacaweather.core.events.ReadingIngested;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Per-location ingestion health built from bus events, so a location that keeps failing is
 * visible without reading logs.
 */
public final class LocationHealthTracker {
    private static final Logger LOGGER = Logger.getLogger(LocationHealthTracker.class.getName());

    private final int persistentFailureThreshold;
    private final ConcurrentHashMap<String, LocationHealth> health = new ConcurrentHashMap<>();

    public LocationHealthTracker(EventBus eventBus, int persistentFailureThreshold) {
        this.persistentFailureThreshold = persistentFailureThreshold;
        eventBus.subscribe(ReadingIngested.class, this::onIngested);
        eventBus.subscribe(AlertRaised.class, this::onAlert);
        eventBus.subscribe(LocationDeferred.class, this::onDeferred);
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> locations = new TreeMap<>();
        for (Map.Entry<String, LocationHealth> entry : health.entrySet()) {
            locations.put(entry.getKey(), entry.getValue().toMap(persistentFailureThreshold));
        }
        return locations;
    }

    public int consecutiveFailures(String locationId) {
        LocationHealth current = health.get(locationId);
        return current == null ? 0 : current.consecutiveFailures();
    }

    private void onIngested(ReadingIngested event) {
        health.compute(event.locationId(), (id, current) -> orEmpty(current).withSuccess(event.timestamp()));
    }

    private void onAlert(AlertRaised event) {
        if (!"fetch".equals(event.category()) || event.details() == null) {
            return;
        }
        Object location = event.details().get("location");
        if (!(location instanceof String locationId) || locationId.isBlank()) {
            return;
        }
        Object errorClass = event.details().get("errorClass");
        LocationHealth updated = health.compute(locationId, (id, current) -> orEmpty(current).withFailure(
                event.timestamp(),
                errorClass == null ? null : errorClass.toString(),
                event.message()
        ));
        if (updated.consecutiveFailures() == persistentFailureThreshold) {
            LOGGER.warning("Location " + locationId + " has failed " + persistentFailureThreshold
                    + " cycles in a row; last error " + updated.lastErrorClass());
        }
    }

    private void onDeferred(LocationDeferred event) {
        health.compute(event.locationId(), (id, current) -> orEmpty(current).withDeferral(event.timestamp()));
    }

    private static LocationHealth orEmpty(LocationHealth current) {
        return current == null ? new LocationHealth(null, null, 0, null, null, null) : current;
    }

    private record LocationHealth(
            Instant lastSuccessAt,
            Instant lastFailureAt,
            int consecutiveFailures,
            String lastErrorClass,
            String lastErrorMessage,
            Instant lastDeferredAt
    ) {
        private LocationHealth withSuccess(Instant at) {
            return new LocationHealth(at, lastFailureAt, 0, lastErrorClass, lastErrorMessage, lastDeferredAt);
        }

        private LocationHealth withFailure(Instant at, String errorClass, String message) {
            return new LocationHealth(lastSuccessAt, at, consecutiveFailures + 1, errorClass, message, lastDeferredAt);
        }

        private LocationHealth withDeferral(Instant at) {
            return new LocationHealth(lastSuccessAt, lastFailureAt, consecutiveFailures, lastErrorClass,
                    lastErrorMessage, at);
        }

        private Map<String, Object> toMap(int threshold) {
            Map<String, Object> map = new HashMap<>();
            map.put("lastSuccessAt", lastSuccessAt == null ? null : lastSuccessAt.toString());
            map.put("lastFailureAt", lastFailureAt == null ? null : lastFailureAt.toString());
            map.put("consecutiveFailures", consecutiveFailures);
            map.put("lastErrorClass", lastErrorClass);
            map.put("lastErrorMessage", lastErrorMessage);
            map.put("lastDeferredAt", lastDeferredAt == null ? null : lastDeferredAt.toString());
            map.put("persistentFailure", consecutiveFailures >= threshold);
            return map;
        }
    }
}
