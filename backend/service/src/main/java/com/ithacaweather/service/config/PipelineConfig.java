package com.ithacaweather.service.config;

import com.ithacaweather.core.model.Location;
import com.ithacaweather.ingest.openweather.OpenWeatherClient;
import com.ithacaweather.ingest.quota.QuotaWindow;
import com.ithacaweather.ingest.retry.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable startup snapshot of everything the pipeline is configured with. Absent optional
 * values fall back to the defaults below; {@link #validate()} rejects what cannot be defaulted.
 */
public record PipelineConfig(
        String apiKey,
        String baseUrl,
        String units,
        Duration pollInterval,
        Duration requestTimeout,
        Duration shutdownGrace,
        String databasePath,
        String quotaStatePath,
        String eventLogPath,
        Integer apiPort,
        QuotaConfig quota,
        RetryConfig retry,
        List<Location> locations
) {
    static final String PLACEHOLDER_API_KEY = "your_api_key_here";
    private static final Set<String> UNITS = Set.of("standard", "metric", "imperial");

    public PipelineConfig {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? OpenWeatherClient.DEFAULT_BASE_URL : baseUrl;
        units = units == null || units.isBlank() ? "imperial" : units;
        pollInterval = pollInterval == null ? Duration.ofMinutes(30) : pollInterval;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
        shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(30) : shutdownGrace;
        databasePath = databasePath == null || databasePath.isBlank() ? "data/weather.db" : databasePath;
        quotaStatePath = quotaStatePath == null || quotaStatePath.isBlank() ? "state/quota.json" : quotaStatePath;
        eventLogPath = eventLogPath == null || eventLogPath.isBlank() ? "logs/events.jsonl" : eventLogPath;
        apiPort = apiPort == null ? 8080 : apiPort;
        quota = quota == null ? new QuotaConfig(null, null) : quota;
        retry = retry == null ? new RetryConfig(null, null, null, null, null) : retry;
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public PipelineConfig withApiKey(String key) {
        return new PipelineConfig(
                key,
                baseUrl,
                units,
                pollInterval,
                requestTimeout,
                shutdownGrace,
                databasePath,
                quotaStatePath,
                eventLogPath,
                apiPort,
                quota,
                retry,
                locations
        );
    }

    public PipelineConfig validate() {
        List<String> problems = new ArrayList<>();
        if (apiKey == null || apiKey.isBlank() || PLACEHOLDER_API_KEY.equals(apiKey)) {
            problems.add("API key is missing (set OPENWEATHER_API_KEY)");
        }
        if (locations.isEmpty()) {
            problems.add("location list is empty");
        }
        Set<String> ids = new HashSet<>();
        for (Location location : locations) {
            if (!ids.add(location.id())) {
                problems.add("duplicate location id " + location.id());
            }
        }
        if (!UNITS.contains(units)) {
            problems.add("units must be one of " + UNITS);
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            problems.add("pollInterval must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            problems.add("requestTimeout must be positive");
        }
        if (shutdownGrace.isNegative()) {
            problems.add("shutdownGrace must not be negative");
        }
        if (apiPort < 0 || apiPort > 65535) {
            problems.add("apiPort must be within 0-65535");
        }
        if (quota.dailyLimit() < 1 || quota.perMinuteLimit() < 1) {
            problems.add("quota limits must be >= 1");
        }
        try {
            retry.toPolicy();
        } catch (IllegalArgumentException e) {
            problems.add("retry: " + e.getMessage());
        }
        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid pipeline configuration: " + String.join("; ", problems));
        }
        return this;
    }

    public record QuotaConfig(Long dailyLimit, Long perMinuteLimit) {
        public QuotaConfig {
            dailyLimit = dailyLimit == null ? 1000L : dailyLimit;
            perMinuteLimit = perMinuteLimit == null ? 60L : perMinuteLimit;
        }

        public List<QuotaWindow> windows() {
            return List.of(QuotaWindow.daily(dailyLimit), QuotaWindow.perMinute(perMinuteLimit));
        }
    }

    public record RetryConfig(
            Integer maxAttempts,
            Duration baseDelay,
            Duration maxDelay,
            Double jitter,
            Duration maxRetryAfter
    ) {
        public RetryConfig {
            maxAttempts = maxAttempts == null ? RetryPolicy.DEFAULT.maxAttempts() : maxAttempts;
            baseDelay = baseDelay == null ? RetryPolicy.DEFAULT.baseDelay() : baseDelay;
            maxDelay = maxDelay == null ? RetryPolicy.DEFAULT.maxDelay() : maxDelay;
            jitter = jitter == null ? RetryPolicy.DEFAULT.jitter() : jitter;
        }

        public RetryPolicy toPolicy() {
            if (maxRetryAfter == null) {
                return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitter);
            }
            return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitter, maxRetryAfter);
        }
    }
}
