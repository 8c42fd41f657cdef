package com.ithacaweather.ingest.support;

import com.ithacaweather.core.error.StorageException;
import com.ithacaweather.core.model.Reading;
import com.ithacaweather.core.model.ReadingKey;
import com.ithacaweather.ingest.api.PersistResult;
import com.ithacaweather.ingest.api.ReadingStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class InMemoryReadingStore implements ReadingStore {
    private final Map<ReadingKey, Reading> rows = new LinkedHashMap<>();
    private final List<List<Reading>> batches = new ArrayList<>();
    private final AtomicInteger failuresRemaining = new AtomicInteger();

    public void failNextPersists(int count) {
        failuresRemaining.set(count);
    }

    public synchronized List<List<Reading>> batches() {
        return List.copyOf(batches);
    }

    public synchronized int size() {
        return rows.size();
    }

    @Override
    public synchronized PersistResult persist(List<Reading> readings) {
        if (failuresRemaining.getAndUpdate(value -> Math.max(0, value - 1)) > 0) {
            throw new StorageException("disk unavailable", null);
        }
        batches.add(List.copyOf(readings));
        int inserted = 0;
        int skipped = 0;
        for (Reading reading : readings) {
            if (rows.putIfAbsent(reading.key(), reading) == null) {
                inserted++;
            } else {
                skipped++;
            }
        }
        return new PersistResult(inserted, skipped);
    }

    @Override
    public synchronized Stream<Reading> queryRange(String locationId, Instant from, Instant to) {
        return rows.values().stream()
                .filter(reading -> reading.locationId().equals(locationId))
                .filter(reading -> !reading.observedAt().isBefore(from) && reading.observedAt().isBefore(to))
                .sorted(Comparator.comparing(Reading::observedAt))
                .toList()
                .stream();
    }

    @Override
    public synchronized Optional<Reading> latestReading(String locationId) {
        return rows.values().stream()
                .filter(reading -> reading.locationId().equals(locationId))
                .max(Comparator.comparing(Reading::observedAt));
    }

    @Override
    public synchronized Map<String, Instant> lastSuccessfulFetches() {
        Map<String, Instant> latest = new HashMap<>();
        for (Reading reading : rows.values()) {
            latest.merge(reading.locationId(), reading.fetchedAt(), (a, b) -> a.isAfter(b) ? a : b);
        }
        return latest;
    }
}
