package com.ithacaweather.ingest.api;

import com.ithacaweather.core.model.Reading;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Durable, append-only home of readings. Uniqueness of (locationId, observedAt) is enforced by
 * the implementation's storage layer; callers may hand it the same reading any number of times.
 */
public interface ReadingStore {
    /**
     * Inserts every reading whose key is not yet present, atomically for the whole batch.
     *
     * @throws com.ithacaweather.core.error.StorageException if nothing could be committed
     */
    PersistResult persist(List<Reading> readings);

    /**
     * Readings for one location with {@code from <= observedAt < to}, ascending by observedAt.
     * The stream holds storage resources until closed.
     */
    Stream<Reading> queryRange(String locationId, Instant from, Instant to);

    Optional<Reading> latestReading(String locationId);

    /**
     * Most recent fetchedAt per location, used to rebuild staleness ordering after a restart.
     */
    Map<String, Instant> lastSuccessfulFetches();
}
