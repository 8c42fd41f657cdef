package com.ithacaweather.service.store;

import com.ithacaweather.core.events.AlertRaised;
import com.ithacaweather.core.events.Event;
import com.ithacaweather.core.events.FetchRetryScheduled;
import com.ithacaweather.core.events.LocationDeferred;
import com.ithacaweather.core.events.ReadingIngested;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Filter over the audit log. {@code type} and {@code locationId} are optional; a location filter
 * drops cycle-level events, which belong to no single location.
 */
public record EventQuery(Instant since, String type, String locationId, int limit) {
    public static final int DEFAULT_LIMIT = 200;

    public EventQuery {
        Objects.requireNonNull(since, "since is required");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
    }

    public static EventQuery recent(int limit) {
        return new EventQuery(Instant.EPOCH, null, null, limit);
    }

    public boolean matches(Event event) {
        if (event.timestamp().isBefore(since)) {
            return false;
        }
        if (type != null && !type.equals(event.type())) {
            return false;
        }
        return locationId == null || locationOf(event).map(locationId::equals).orElse(false);
    }

    static Optional<String> locationOf(Event event) {
        if (event instanceof ReadingIngested ingested) {
            return Optional.of(ingested.locationId());
        }
        if (event instanceof LocationDeferred deferred) {
            return Optional.of(deferred.locationId());
        }
        if (event instanceof FetchRetryScheduled retry) {
            return Optional.of(retry.locationId());
        }
        if (event instanceof AlertRaised alert && alert.details() != null
                && alert.details().get("location") instanceof String location) {
            return Optional.of(location);
        }
        return Optional.empty();
    }
}
