package com.ithacaweather.ingest.orchestrator;

import com.ithacaweather.core.bus.EventBus;
import com.ithacaweather.core.error.ErrorClass;
import com.ithacaweather.core.error.FetchException;
import com.ithacaweather.core.error.StorageException;
import com.ithacaweather.core.events.AlertRaised;
import com.ithacaweather.core.events.CycleCompleted;
import com.ithacaweather.core.events.CycleFailed;
import com.ithacaweather.core.events.CycleStarted;
import com.ithacaweather.core.events.LocationDeferred;
import com.ithacaweather.core.events.ReadingIngested;
import com.ithacaweather.core.model.Location;
import com.ithacaweather.core.model.Reading;
import com.ithacaweather.ingest.api.PersistResult;
import com.ithacaweather.ingest.api.ReadingStore;
import com.ithacaweather.ingest.api.WeatherApiClient;
import com.ithacaweather.ingest.quota.QuotaState;
import com.ithacaweather.ingest.retry.RetryExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans one poll cycle out over the configured locations, isolates per-location failures and
 * hands every successful reading to the store as a single batch.
 */
public final class LocationFetchOrchestrator {
    private static final Logger LOGGER = Logger.getLogger(LocationFetchOrchestrator.class.getName());

    private final WeatherApiClient client;
    private final RetryExecutor retryExecutor;
    private final ReadingStore store;
    private final QuotaState quota;
    private final EventBus eventBus;
    private final Clock clock;
    private final Map<String, Instant> lastSuccess = new ConcurrentHashMap<>();
    private final AtomicLong cycles = new AtomicLong();

    public LocationFetchOrchestrator(
            WeatherApiClient client,
            RetryExecutor retryExecutor,
            ReadingStore store,
            QuotaState quota,
            EventBus eventBus,
            Clock clock
    ) {
        this.client = client;
        this.retryExecutor = retryExecutor;
        this.store = store;
        this.quota = quota;
        this.eventBus = eventBus;
        this.clock = clock;
        lastSuccess.putAll(store.lastSuccessfulFetches());
    }

    /**
     * Runs one cycle to completion: fetches, persists and reports.
     *
     * @throws StorageException when the batch could not be persisted; fetch outcomes are logged
     *                          and published before it propagates
     */
    public CycleResult runCycle(List<Location> locations) {
        long cycle = cycles.incrementAndGet();
        Instant startedAt = clock.instant();

        List<Location> ordered = stalenessOrder(locations);
        long budget = quota.remaining();
        int scheduledCount = (int) Math.min(ordered.size(), budget);
        List<Location> scheduled = ordered.subList(0, scheduledCount);
        List<Location> deferred = ordered.subList(scheduledCount, ordered.size());

        eventBus.publish(new CycleStarted(startedAt, cycle, scheduled.size(), deferred.size()));
        for (Location location : deferred) {
            LOGGER.warning("Deferring " + location.id() + " to the next cycle; quota remaining " + budget);
            eventBus.publish(new LocationDeferred(clock.instant(), cycle, location.id(), (int) Math.min(budget, Integer.MAX_VALUE)));
        }

        List<CompletableFuture<LocationOutcome>> tasks = new ArrayList<>();
        for (Location location : scheduled) {
            tasks.add(retryExecutor.execute(location, () -> client.fetch(location))
                    .handle((reading, error) -> error == null
                            ? LocationOutcome.success(location, reading)
                            : LocationOutcome.failure(location, asFetchException(location, error))));
        }
        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();

        List<Reading> succeeded = new ArrayList<>();
        List<LocationFailure> failed = new ArrayList<>();
        for (CompletableFuture<LocationOutcome> task : tasks) {
            LocationOutcome outcome = task.join();
            if (outcome.reading() != null) {
                succeeded.add(outcome.reading());
            } else {
                failed.add(new LocationFailure(outcome.location(), outcome.error()));
                reportFailure(outcome.location(), outcome.error());
            }
        }

        PersistResult persisted;
        try {
            persisted = succeeded.isEmpty() ? PersistResult.NOTHING : store.persist(succeeded);
        } catch (StorageException e) {
            LOGGER.log(Level.SEVERE, "Cycle " + cycle + " failed to persist " + succeeded.size() + " readings", e);
            eventBus.publish(new CycleFailed(clock.instant(), cycle, e.errorClass().name(), e.getMessage()));
            throw e;
        }

        for (Reading reading : succeeded) {
            lastSuccess.merge(reading.locationId(), reading.fetchedAt(), (a, b) -> a.isAfter(b) ? a : b);
            eventBus.publish(new ReadingIngested(
                    clock.instant(),
                    reading.locationId(),
                    reading.observedAt(),
                    reading.temperature(),
                    reading.conditionDescription()
            ));
        }

        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        LOGGER.info("Cycle " + cycle + " finished: " + succeeded.size() + " fetched, " + failed.size()
                + " failed, " + deferred.size() + " deferred, " + persisted.inserted() + " inserted, "
                + persisted.skippedDuplicate() + " duplicates");
        eventBus.publish(new CycleCompleted(
                clock.instant(),
                cycle,
                succeeded.size(),
                failed.size(),
                deferred.size(),
                persisted.inserted(),
                persisted.skippedDuplicate(),
                durationMillis
        ));
        return new CycleResult(cycle, startedAt, succeeded, failed, deferred, persisted);
    }

    /**
     * Asks in-flight fetches to stop after their current attempt.
     */
    public void requestStop() {
        retryExecutor.stop();
    }

    public Map<String, Instant> lastSuccessfulFetches() {
        return Map.copyOf(lastSuccess);
    }

    /**
     * Never-fetched locations first, then oldest success first; ties keep configuration order.
     */
    List<Location> stalenessOrder(List<Location> locations) {
        List<Location> ordered = new ArrayList<>(locations);
        ordered.sort(Comparator.comparing((Location location) -> lastSuccess.getOrDefault(location.id(), Instant.MIN)));
        return ordered;
    }

    private void reportFailure(Location location, FetchException error) {
        LOGGER.warning("Fetch failed for " + location.id() + " (" + error.errorClass() + "): " + error.getMessage());
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "fetch",
                "Weather fetch failed for " + location.id() + ": " + error.getMessage(),
                Map.of(
                        "location", location.id(),
                        "errorClass", error.errorClass().name(),
                        "lastErrorClass", error.lastErrorClass().name()
                )
        ));
    }

    private static FetchException asFetchException(Location location, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof FetchException fetchException) {
            return fetchException;
        }
        return new FetchException(
                ErrorClass.CLIENT_ERROR,
                location.id(),
                "Unexpected failure fetching " + location.id() + ": " + cause,
                cause
        );
    }

    private record LocationOutcome(Location location, Reading reading, FetchException error) {
        static LocationOutcome success(Location location, Reading reading) {
            return new LocationOutcome(location, reading, null);
        }

        static LocationOutcome failure(Location location, FetchException error) {
            return new LocationOutcome(location, null, error);
        }
    }
}
