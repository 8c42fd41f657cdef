package com.ithacaweather.service.runtime;

import com.ithacaweather.core.bus.EventBus;
import com.ithacaweather.core.events.CycleCompleted;
import com.ithacaweather.core.events.CycleFailed;
import com.ithacaweather.ingest.openweather.OpenWeatherClient;
import com.ithacaweather.ingest.orchestrator.LocationFetchOrchestrator;
import com.ithacaweather.ingest.quota.QuotaState;
import com.ithacaweather.ingest.retry.RetryExecutor;
import com.ithacaweather.service.api.ApiServer;
import com.ithacaweather.service.api.LocationHealthTracker;
import com.ithacaweather.service.config.ConfigException;
import com.ithacaweather.service.config.PipelineConfig;
import com.ithacaweather.service.http.HttpClientFactory;
import com.ithacaweather.service.store.JsonlEventStore;
import com.ithacaweather.service.store.QuotaSnapshotFile;
import com.ithacaweather.service.store.SqliteReadingStore;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The assembled pipeline: stores, quota, client, retry executor, orchestrator, scheduler and the
 * optional read API. {@link #start()} begins polling; {@link #close()} drains and releases threads.
 */
public final class IngestionRuntime implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(IngestionRuntime.class.getName());
    private static final int MAX_WORKERS = 10;
    private static final int PERSISTENT_FAILURE_THRESHOLD = 3;

    private final EventBus eventBus;
    private final SqliteReadingStore readingStore;
    private final JsonlEventStore eventStore;
    private final QuotaState quota;
    private final QuotaSnapshotFile quotaFile;
    private final LocationHealthTracker healthTracker;
    private final ExecutorService workers;
    private final ScheduledExecutorService retryTimer;
    private final RetryExecutor retryExecutor;
    private final IngestionScheduler scheduler;
    private final ApiServer apiServer;

    private IngestionRuntime(PipelineConfig config, Map<String, String> environment, Clock clock) {
        this.eventBus = new EventBus();
        this.readingStore = new SqliteReadingStore(Path.of(config.databasePath()));
        this.eventStore = new JsonlEventStore(Path.of(config.eventLogPath()));
        eventBus.subscribeAll(eventStore::append);
        this.healthTracker = new LocationHealthTracker(eventBus, PERSISTENT_FAILURE_THRESHOLD);

        this.quota = new QuotaState(clock, config.quota().windows());
        this.quotaFile = new QuotaSnapshotFile(Path.of(config.quotaStatePath()));
        quotaFile.load().ifPresent(quota::restore);
        eventBus.subscribe(CycleCompleted.class, event -> saveQuota());
        eventBus.subscribe(CycleFailed.class, event -> saveQuota());

        HttpClient httpClient;
        try {
            httpClient = HttpClientFactory.create(config.requestTimeout(), environment);
        } catch (IllegalStateException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        OpenWeatherClient client = new OpenWeatherClient(
                httpClient,
                config.baseUrl(),
                config.apiKey(),
                config.units(),
                config.requestTimeout(),
                quota,
                clock
        );

        this.workers = Executors.newFixedThreadPool(
                Math.max(1, Math.min(config.locations().size(), MAX_WORKERS)),
                daemonFactory("ingest-fetch")
        );
        this.retryTimer = Executors.newSingleThreadScheduledExecutor(daemonFactory("ingest-retry-timer"));
        this.retryExecutor = new RetryExecutor(config.retry().toPolicy(), retryTimer, workers, eventBus, clock);
        LocationFetchOrchestrator orchestrator = new LocationFetchOrchestrator(
                client,
                retryExecutor,
                readingStore,
                quota,
                eventBus,
                clock
        );
        this.scheduler = IngestionScheduler.forOrchestrator(
                orchestrator,
                config.locations(),
                config.pollInterval(),
                config.shutdownGrace(),
                clock
        );
        this.apiServer = config.apiPort() > 0
                ? new ApiServer(config.apiPort(), config.locations(), readingStore, eventStore, quota, scheduler,
                healthTracker)
                : null;
    }

    /**
     * Builds the pipeline without starting it.
     *
     * @throws com.ithacaweather.core.error.StorageException when the reading store cannot be opened
     * @throws IllegalStateException                          when persisted quota state is unreadable
     * @throws ConfigException                                when the HTTP client cannot be configured
     */
    public static IngestionRuntime create(PipelineConfig config, Map<String, String> environment, Clock clock) {
        return new IngestionRuntime(config, environment, clock);
    }

    public void start() {
        if (apiServer != null) {
            apiServer.start();
        }
        scheduler.start();
    }

    public IngestionScheduler scheduler() {
        return scheduler;
    }

    public SqliteReadingStore readingStore() {
        return readingStore;
    }

    public QuotaState quota() {
        return quota;
    }

    public LocationHealthTracker healthTracker() {
        return healthTracker;
    }

    public int apiPort() {
        return apiServer == null ? -1 : apiServer.actualPort();
    }

    @Override
    public void close() {
        boolean drained = scheduler.shutdown();
        if (!drained) {
            LOGGER.warning("Shutdown grace elapsed with a cycle still running");
        }
        retryExecutor.stop();
        retryTimer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (apiServer != null) {
            apiServer.stop();
        }
        saveQuota();
        LOGGER.info("Ingestion pipeline stopped");
    }

    private void saveQuota() {
        try {
            quotaFile.save(quota.snapshot());
        } catch (IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Quota state not persisted", e);
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
