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
import com.ithacaweather.ingest.api.WeatherApiClient;
import com.ithacaweather.ingest.openweather.ReadingNormalizer;
import com.ithacaweather.ingest.quota.QuotaState;
import com.ithacaweather.ingest.quota.QuotaWindow;
import com.ithacaweather.ingest.retry.RetryExecutor;
import com.ithacaweather.ingest.retry.RetryPolicy;
import com.ithacaweather.ingest.support.EventCapture;
import com.ithacaweather.ingest.support.FixtureUtils;
import com.ithacaweather.ingest.support.InMemoryReadingStore;
import com.ithacaweather.ingest.support.MutableClock;
import com.ithacaweather.ingest.support.TestReadings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocationFetchOrchestratorTest {
    private static final Instant OBSERVED = Instant.parse("2026-03-01T15:00:00Z");
    private static final List<Location> LOCATIONS = List.of(
            TestReadings.location("downtown"),
            TestReadings.location("cornell-campus"),
            TestReadings.location("ithaca-college"),
            TestReadings.location("cayuga-lake")
    );

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T15:04:00Z"), ZoneOffset.UTC);
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService workers = Executors.newFixedThreadPool(4);
    private final EventBus bus = new EventBus((event, error) -> {
        throw new AssertionError("Unexpected handler error", error);
    });
    private final EventCapture capture = new EventCapture(bus);
    private final InMemoryReadingStore store = new InMemoryReadingStore();

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
        workers.shutdownNow();
    }

    @Test
    void successfulCyclePersistsOneBatchAndReports() {
        QuotaState quota = quota(60);
        ScriptedClient client = new ScriptedClient(quota);
        LocationFetchOrchestrator orchestrator = orchestrator(client, quota);

        CycleResult result = orchestrator.runCycle(LOCATIONS);

        assertTrue(result.fullySucceeded());
        assertEquals(4, result.succeeded().size());
        assertEquals(4, result.persisted().inserted());
        assertEquals(1, store.batches().size());
        assertEquals(4, capture.byType(ReadingIngested.class).size());
        CycleStarted started = capture.byType(CycleStarted.class).get(0);
        assertEquals(4, started.scheduledLocations());
        assertEquals(0, started.deferredLocations());
        CycleCompleted completed = capture.byType(CycleCompleted.class).get(0);
        assertEquals(4, completed.succeeded());
        assertEquals(4, completed.inserted());
        assertEquals(4, orchestrator.lastSuccessfulFetches().size());
    }

    @Test
    void quotaBudgetDefersStalestLocationsLast() {
        store.persist(List.of(
                TestReadings.reading("downtown", OBSERVED.minusSeconds(3600), Instant.parse("2026-03-01T14:01:00Z")),
                TestReadings.reading("cornell-campus", OBSERVED.minusSeconds(3600), Instant.parse("2026-03-01T14:02:00Z"))
        ));
        QuotaState quota = quota(2);
        ScriptedClient client = new ScriptedClient(quota);
        LocationFetchOrchestrator orchestrator = orchestrator(client, quota);

        CycleResult result = orchestrator.runCycle(LOCATIONS);

        assertEquals(Set.of("ithaca-college", "cayuga-lake"), client.calledIds());
        assertEquals(List.of("downtown", "cornell-campus"),
                result.deferred().stream().map(Location::id).toList());
        List<LocationDeferred> deferred = capture.byType(LocationDeferred.class);
        assertEquals(2, deferred.size());
        assertEquals(2, deferred.get(0).quotaRemaining());
        assertEquals(0, quota.remaining());
        assertFalse(result.fullySucceeded());
    }

    @Test
    void exhaustedQuotaDefersEveryLocationWithoutCalls() {
        QuotaState quota = quota(1);
        quota.tryAcquire();
        ScriptedClient client = new ScriptedClient(quota);

        CycleResult result = orchestrator(client, quota).runCycle(LOCATIONS);

        assertEquals(0, client.calls.get());
        assertEquals(4, result.deferred().size());
        assertTrue(store.batches().isEmpty());
        assertEquals(4, capture.byType(LocationDeferred.class).size());
    }

    @Test
    void oneMalformedLocationDoesNotAffectOthers() {
        QuotaState quota = quota(60);
        ScriptedClient client = new ScriptedClient(quota);
        client.fail("cayuga-lake", ErrorClass.MALFORMED);

        CycleResult result = orchestrator(client, quota).runCycle(LOCATIONS);

        assertEquals(3, result.succeeded().size());
        assertEquals(1, result.failed().size());
        LocationFailure failure = result.failed().get(0);
        assertEquals("cayuga-lake", failure.location().id());
        assertEquals(ErrorClass.MALFORMED, failure.error().errorClass());
        assertEquals(3, store.size());

        AlertRaised alert = capture.byType(AlertRaised.class).get(0);
        assertEquals("fetch", alert.category());
        assertEquals("cayuga-lake", alert.details().get("location"));
        assertEquals("MALFORMED", alert.details().get("errorClass"));
    }

    @Test
    void exhaustedRetriesAreReportedWithLastErrorClass() {
        QuotaState quota = quota(60);
        ScriptedClient client = new ScriptedClient(quota);
        client.fail("downtown", ErrorClass.TRANSIENT);

        CycleResult result = orchestrator(client, quota).runCycle(LOCATIONS);

        assertEquals(3, client.callsFor("downtown"));
        FetchException error = result.failed().get(0).error();
        assertEquals(ErrorClass.RETRIES_EXHAUSTED, error.errorClass());
        AlertRaised alert = capture.byType(AlertRaised.class).get(0);
        assertEquals("TRANSIENT", alert.details().get("lastErrorClass"));
    }

    @Test
    void unexpectedClientFailureIsClassifiedAsClientError() {
        QuotaState quota = quota(60);
        WeatherApiClient broken = location -> {
            throw new IllegalStateException("boom");
        };

        CycleResult result = orchestrator(broken, quota).runCycle(LOCATIONS.subList(0, 1));

        assertEquals(ErrorClass.CLIENT_ERROR, result.failed().get(0).error().errorClass());
    }

    @Test
    void repeatedObservationIsSkippedAsDuplicate() {
        QuotaState quota = quota(60);
        LocationFetchOrchestrator orchestrator = orchestrator(new ScriptedClient(quota), quota);

        orchestrator.runCycle(LOCATIONS);
        clock.advance(Duration.ofMinutes(1));
        CycleResult second = orchestrator.runCycle(LOCATIONS);

        assertEquals(0, second.persisted().inserted());
        assertEquals(4, second.persisted().skippedDuplicate());
        assertEquals(4, store.size());
        assertEquals(2L, second.cycle());
    }

    @Test
    void storageFailurePublishesCycleFailedAndKeepsStaleness() {
        QuotaState quota = quota(60);
        LocationFetchOrchestrator orchestrator = orchestrator(new ScriptedClient(quota), quota);
        store.failNextPersists(1);

        StorageException error = assertThrows(StorageException.class, () -> orchestrator.runCycle(LOCATIONS));

        assertEquals("disk unavailable", error.getMessage());
        CycleFailed failed = capture.byType(CycleFailed.class).get(0);
        assertEquals("STORAGE_FAILURE", failed.errorClass());
        assertTrue(capture.byType(ReadingIngested.class).isEmpty());
        assertTrue(capture.byType(CycleCompleted.class).isEmpty());
        assertTrue(orchestrator.lastSuccessfulFetches().isEmpty());

        CycleResult retried = orchestrator.runCycle(LOCATIONS);
        assertEquals(4, retried.persisted().inserted());
    }

    @Test
    void observationTimeOutsideStorableRangeOnlyFailsThatLocation() {
        QuotaState quota = quota(60);
        ReadingNormalizer normalizer = new ReadingNormalizer("imperial");
        String goodBody = FixtureUtils.fixture("fixtures/openweather-current.json");
        String farFutureBody = goodBody.replace("\"dt\": 1772377200", "\"dt\": 10000000000000000");
        WeatherApiClient client = location -> {
            quota.tryAcquire();
            String body = location.id().equals("cayuga-lake") ? farFutureBody : goodBody;
            return normalizer.normalize(location, body, clock.instant());
        };

        CycleResult result = orchestrator(client, quota).runCycle(LOCATIONS);

        assertEquals(3, result.succeeded().size());
        assertEquals(3, store.size());
        LocationFailure failure = result.failed().get(0);
        assertEquals("cayuga-lake", failure.location().id());
        assertEquals(ErrorClass.MALFORMED, failure.error().errorClass());
        assertEquals(1, capture.byType(CycleCompleted.class).size());
        assertTrue(capture.byType(CycleFailed.class).isEmpty());
    }

    @Test
    void absurdRetryAfterDoesNotHoldTheCycleOpen() {
        QuotaState quota = quota(60);
        AtomicInteger rateLimitedCalls = new AtomicInteger();
        WeatherApiClient client = location -> {
            quota.tryAcquire();
            if (location.id().equals("downtown")) {
                rateLimitedCalls.incrementAndGet();
                throw new FetchException(ErrorClass.RATE_LIMITED, location.id(), "HTTP 429", 429,
                        Duration.ofSeconds(100_000_000_000_000_000L), null);
            }
            return TestReadings.reading(location.id(), OBSERVED, clock.instant());
        };

        CycleResult result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> orchestrator(client, quota).runCycle(LOCATIONS));

        assertEquals(1, rateLimitedCalls.get());
        assertEquals(3, result.succeeded().size());
        LocationFailure failure = result.failed().get(0);
        assertEquals("downtown", failure.location().id());
        assertEquals(ErrorClass.RETRIES_EXHAUSTED, failure.error().errorClass());
        assertEquals(ErrorClass.RATE_LIMITED, failure.error().lastErrorClass());
    }

    @Test
    void stalenessOrderPutsNeverFetchedFirstThenOldest() {
        store.persist(List.of(
                TestReadings.reading("downtown", OBSERVED, Instant.parse("2026-03-01T14:30:00Z")),
                TestReadings.reading("cornell-campus", OBSERVED, Instant.parse("2026-03-01T13:30:00Z")),
                TestReadings.reading("cayuga-lake", OBSERVED, Instant.parse("2026-03-01T14:00:00Z"))
        ));
        QuotaState quota = quota(60);
        LocationFetchOrchestrator orchestrator = orchestrator(new ScriptedClient(quota), quota);

        List<String> order = orchestrator.stalenessOrder(LOCATIONS).stream()
                .map(Location::id)
                .collect(Collectors.toList());

        assertEquals(List.of("ithaca-college", "cornell-campus", "cayuga-lake", "downtown"), order);
    }

    private LocationFetchOrchestrator orchestrator(WeatherApiClient client, QuotaState quota) {
        RetryExecutor retryExecutor = new RetryExecutor(
                new RetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(20), 0),
                timer,
                workers,
                bus,
                clock
        );
        return new LocationFetchOrchestrator(client, retryExecutor, store, quota, bus, clock);
    }

    private QuotaState quota(long perMinute) {
        return new QuotaState(clock, List.of(QuotaWindow.daily(1000), QuotaWindow.perMinute(perMinute)));
    }

    private final class ScriptedClient implements WeatherApiClient {
        private final QuotaState quota;
        private final Map<String, ErrorClass> failures = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> callsById = new ConcurrentHashMap<>();
        private final AtomicInteger calls = new AtomicInteger();

        private ScriptedClient(QuotaState quota) {
            this.quota = quota;
        }

        void fail(String locationId, ErrorClass errorClass) {
            failures.put(locationId, errorClass);
        }

        Set<String> calledIds() {
            return Set.copyOf(callsById.keySet());
        }

        int callsFor(String locationId) {
            AtomicInteger count = callsById.get(locationId);
            return count == null ? 0 : count.get();
        }

        @Override
        public Reading fetch(Location location) throws FetchException {
            calls.incrementAndGet();
            callsById.computeIfAbsent(location.id(), ignored -> new AtomicInteger()).incrementAndGet();
            if (!quota.tryAcquire()) {
                throw new FetchException(ErrorClass.QUOTA_EXCEEDED, location.id(), "quota exhausted");
            }
            ErrorClass failure = failures.get(location.id());
            if (failure != null) {
                throw new FetchException(failure, location.id(), "scripted " + failure);
            }
            return TestReadings.reading(location.id(), OBSERVED, clock.instant());
        }
    }
}
