package com.ithacaweather.ingest.openweather;

import com.ithacaweather.core.error.ErrorClass;
import com.ithacaweather.core.error.FetchException;
import com.ithacaweather.core.model.Location;
import com.ithacaweather.core.model.Reading;
import com.ithacaweather.ingest.api.WeatherApiClient;
import com.ithacaweather.ingest.quota.QuotaState;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.logging.Logger;

public final class OpenWeatherClient implements WeatherApiClient {
    public static final String DEFAULT_BASE_URL = "https://api.openweathermap.org/data/2.5/weather";

    private static final Logger LOGGER = Logger.getLogger(OpenWeatherClient.class.getName());

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final String units;
    private final Duration timeout;
    private final QuotaState quota;
    private final ReadingNormalizer normalizer;
    private final Clock clock;

    public OpenWeatherClient(
            HttpClient httpClient,
            String baseUrl,
            String apiKey,
            String units,
            Duration timeout,
            QuotaState quota,
            Clock clock
    ) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.units = units;
        this.timeout = timeout;
        this.quota = quota;
        this.normalizer = new ReadingNormalizer(units);
        this.clock = clock;
    }

    @Override
    public Reading fetch(Location location) throws FetchException {
        if (!quota.tryAcquire()) {
            throw new FetchException(
                    ErrorClass.QUOTA_EXCEEDED,
                    location.id(),
                    "Quota window exhausted; skipped call for " + location.id()
            );
        }

        HttpRequest request = HttpRequest.newBuilder(requestUri(location))
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new FetchException(ErrorClass.TRANSIENT, location.id(), "Request timed out for " + location.id(), e);
        } catch (IOException e) {
            throw new FetchException(ErrorClass.TRANSIENT, location.id(), "Network failure for " + location.id(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(ErrorClass.TRANSIENT, location.id(), "Request interrupted for " + location.id(), e);
        }

        Instant fetchedAt = clock.instant();
        int status = response.statusCode();
        if (status / 100 == 2) {
            return normalizer.normalize(location, response.body(), fetchedAt);
        }
        if (status == 429) {
            Duration retryAfter = parseRetryAfter(response.headers().firstValue("Retry-After"), fetchedAt).orElse(null);
            throw new FetchException(
                    ErrorClass.RATE_LIMITED,
                    location.id(),
                    "Provider rate limited request for " + location.id(),
                    status,
                    retryAfter,
                    null
            );
        }
        if (status >= 500) {
            throw new FetchException(
                    ErrorClass.TRANSIENT,
                    location.id(),
                    "Provider returned " + status + " for " + location.id(),
                    status,
                    null,
                    null
            );
        }
        LOGGER.warning("Provider rejected request for " + location.id() + " with status " + status);
        throw new FetchException(
                ErrorClass.CLIENT_ERROR,
                location.id(),
                "Provider returned " + status + " for " + location.id(),
                status,
                null,
                null
        );
    }

    URI requestUri(Location location) {
        String query = "lat=" + location.latitude()
                + "&lon=" + location.longitude()
                + "&units=" + encode(units)
                + "&appid=" + encode(apiKey);
        return URI.create(baseUrl + (baseUrl.contains("?") ? "&" : "?") + query);
    }

    /**
     * Retry-After is either delta-seconds or an HTTP-date; anything else is ignored.
     */
    static Optional<Duration> parseRetryAfter(Optional<String> header, Instant now) {
        if (header.isEmpty() || header.get().isBlank()) {
            return Optional.empty();
        }
        String value = header.get().trim();
        try {
            long seconds = Long.parseLong(value);
            return seconds < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
        } catch (NumberFormatException notSeconds) {
            try {
                Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                Duration until = Duration.between(now, at);
                return Optional.of(until.isNegative() ? Duration.ZERO : until);
            } catch (DateTimeParseException notDate) {
                LOGGER.fine("Ignoring unparseable Retry-After header: " + value);
                return Optional.empty();
            }
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
