package com.ithacaweather.service.store;

import com.ithacaweather.core.events.AlertRaised;
import com.ithacaweather.core.events.CycleCompleted;
import com.ithacaweather.core.events.CycleFailed;
import com.ithacaweather.core.events.Event;
import com.ithacaweather.core.events.FetchRetryScheduled;
import com.ithacaweather.core.events.LocationDeferred;
import com.ithacaweather.core.events.ReadingIngested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    private static final Instant AT = Instant.parse("2026-03-01T15:00:00Z");

    @Test
    void linesCarryTypeTimestampAndPayload() {
        String line = EventCodec.toJsonLine(new CycleFailed(AT, 12, "STORAGE_FAILURE", "database is locked"));

        assertTrue(line.contains("\"type\":\"CycleFailed\""));
        assertTrue(line.contains("\"timestamp\":\"2026-03-01T15:00:00Z\""));
        assertFalse(line.contains("\n"));
        assertEquals(new CycleFailed(AT, 12, "STORAGE_FAILURE", "database is locked"), EventCodec.fromJsonLine(line));
    }

    @Test
    void everyPipelineEventDecodesToItsOwnType() {
        List<Event> events = List.of(
                new CycleCompleted(AT, 1, 3, 1, 0, 3, 0, 820),
                new ReadingIngested(AT, "downtown", AT.minusSeconds(240), 38.66, "broken clouds"),
                new LocationDeferred(AT, 1, "cayuga-lake", 0),
                new FetchRetryScheduled(AT, "cornell-campus", 2, "TRANSIENT", 2000),
                new AlertRaised(AT, "fetch", "failed", Map.of("location", "downtown"))
        );

        for (Event event : events) {
            Event decoded = EventCodec.fromJsonLine(EventCodec.toJsonLine(event));
            assertEquals(event.getClass(), decoded.getClass());
            assertTrue(EventCodec.isKnownType(event.type()));
        }
    }

    @Test
    void rejectsUnsupportedOrInvalidPayload() {
        IllegalArgumentException unsupported = assertThrows(IllegalArgumentException.class, () ->
                EventCodec.fromJsonLine("{\"type\":\"Nope\",\"timestamp\":\"2026-03-01T15:00:00Z\",\"event\":{}}")
        );
        assertTrue(unsupported.getMessage().contains("Unsupported event type"));

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () ->
                EventCodec.fromJsonLine("not-json")
        );
        assertTrue(invalid.getMessage().contains("Unable to deserialize event"));
        assertFalse(EventCodec.isKnownType("Nope"));
    }
}
