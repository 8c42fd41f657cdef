package com.ithacaweather.service.api;

import com.ithacaweather.core.events.Event;
import com.ithacaweather.core.model.Location;
import com.ithacaweather.core.model.Reading;
import com.ithacaweather.core.util.JsonUtils;
import com.ithacaweather.ingest.api.ReadingStore;
import com.ithacaweather.ingest.orchestrator.CycleResult;
import com.ithacaweather.ingest.quota.QuotaState;
import com.ithacaweather.service.runtime.IngestionScheduler;
import com.ithacaweather.service.store.EventQuery;
import com.ithacaweather.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only JSON view over stored readings, audit events and pipeline status.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final Instant OPEN_END = Instant.ofEpochMilli(Long.MAX_VALUE);
    private static final Instant EARLIEST_STORABLE = Instant.ofEpochMilli(Long.MIN_VALUE);

    private final int port;
    private final List<Location> locations;
    private final Map<String, Location> locationsById;
    private final ReadingStore readingStore;
    private final EventStore eventStore;
    private final QuotaState quota;
    private final IngestionScheduler scheduler;
    private final LocationHealthTracker healthTracker;
    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            List<Location> locations,
            ReadingStore readingStore,
            EventStore eventStore,
            QuotaState quota,
            IngestionScheduler scheduler,
            LocationHealthTracker healthTracker
    ) {
        this.port = port;
        this.locations = List.copyOf(locations);
        this.locationsById = this.locations.stream()
                .collect(Collectors.toMap(Location::id, location -> location, (a, b) -> a, LinkedHashMap::new));
        this.readingStore = readingStore;
        this.eventStore = eventStore;
        this.quota = quota;
        this.scheduler = scheduler;
        this.healthTracker = healthTracker;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4);
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/locations", this::handleLocations);
            server.createContext("/api/readings", this::handleReadings);
            server.createContext("/api/readings/latest", this::handleLatest);
            server.createContext("/api/status", this::handleStatus);
            server.createContext("/api/events", this::handleEvents);
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleLocations(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, locations);
    }

    private void handleReadings(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        // The /api/readings context also receives unknown sub-paths.
        if (!"/api/readings".equals(exchange.getRequestURI().getPath())) {
            writeJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }

        String locationId;
        Instant from;
        Instant to;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            locationId = requireParam(query, "location");
            from = query.containsKey("from") ? storableInstant(query.get("from")) : Instant.EPOCH;
            to = query.containsKey("to") ? storableInstant(query.get("to")) : OPEN_END;
            if (from.isAfter(to)) {
                throw new IllegalArgumentException("from is after to");
            }
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        if (!locationsById.containsKey(locationId)) {
            writeJson(exchange, 404, Map.of("error", "unknown_location", "location", locationId));
            return;
        }

        List<Reading> readings;
        try (Stream<Reading> stream = readingStore.queryRange(locationId, from, to)) {
            readings = stream.collect(Collectors.toList());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Reading query failed for " + locationId, e);
            writeJson(exchange, 500, Map.of("error", "storage_failure"));
            return;
        }
        writeJson(exchange, 200, readings);
    }

    private void handleLatest(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        String locationId;
        try {
            locationId = requireParam(queryParams(exchange.getRequestURI()), "location");
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        if (!locationsById.containsKey(locationId)) {
            writeJson(exchange, 404, Map.of("error", "unknown_location", "location", locationId));
            return;
        }
        Optional<Reading> latest;
        try {
            latest = readingStore.latestReading(locationId);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Latest reading lookup failed for " + locationId, e);
            writeJson(exchange, 500, Map.of("error", "storage_failure"));
            return;
        }
        if (latest.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "no_readings", "location", locationId));
            return;
        }
        writeJson(exchange, 200, latest.get());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    // Readings are stored as epoch milliseconds; instants past that range are rejected.
    private static Instant storableInstant(String value) {
        Instant instant = Instant.parse(value);
        if (instant.isAfter(OPEN_END) || instant.isBefore(EARLIEST_STORABLE)) {
            throw new IllegalArgumentException("Instant outside storable range: " + value);
        }
        return instant;
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("scheduler", scheduler.state().name());
        status.put("cyclesStarted", scheduler.cyclesStarted());
        status.put("cyclesFailed", scheduler.cyclesFailed());
        CycleResult lastResult = scheduler.lastResult();
        status.put("lastCycle", lastResult == null ? null : cycleSummary(lastResult));
        status.put("quotaRemaining", quota.remaining());
        status.put("quota", quota.snapshot());
        status.put("locations", healthTracker.snapshot());
        writeJson(exchange, 200, status);
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }

        EventQuery eventQuery;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            Instant since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            int limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : EventQuery.DEFAULT_LIMIT;
            eventQuery = new EventQuery(since, blankToNull(query.get("type")), blankToNull(query.get("location")),
                    Math.max(1, limit));
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        if (eventQuery.locationId() != null && !locationsById.containsKey(eventQuery.locationId())) {
            writeJson(exchange, 404, Map.of("error", "unknown_location", "location", eventQuery.locationId()));
            return;
        }

        List<Event> events;
        try {
            events = eventStore.query(eventQuery);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Event query failed", e);
            writeJson(exchange, 500, Map.of("error", "event_log_failure"));
            return;
        }
        writeJson(exchange, 200, events);
    }

    private static Map<String, Object> cycleSummary(CycleResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("cycle", result.cycle());
        summary.put("startedAt", result.startedAt().toString());
        summary.put("succeeded", result.succeeded().size());
        summary.put("failed", result.failed().size());
        summary.put("deferred", result.deferred().size());
        summary.put("inserted", result.persisted().inserted());
        summary.put("skippedDuplicate", result.persisted().skippedDuplicate());
        return summary;
    }

    private static String requireParam(Map<String, String> query, String name) {
        String value = query.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + name);
        }
        return value;
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET");
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
