package com.ithacaweather.ingest.quota;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public record QuotaWindow(String name, long limit, ChronoUnit unit) {
    public QuotaWindow {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(unit, "unit is required");
        if (limit < 1) {
            throw new IllegalArgumentException("Quota limit for " + name + " must be >= 1");
        }
        if (unit != ChronoUnit.MINUTES && unit != ChronoUnit.HOURS && unit != ChronoUnit.DAYS) {
            throw new IllegalArgumentException("Unsupported quota window unit: " + unit);
        }
    }

    public static QuotaWindow daily(long limit) {
        return new QuotaWindow("daily", limit, ChronoUnit.DAYS);
    }

    public static QuotaWindow perMinute(long limit) {
        return new QuotaWindow("perMinute", limit, ChronoUnit.MINUTES);
    }

    /**
     * Start of the UTC-aligned window containing {@code now}.
     */
    public Instant windowStart(Instant now) {
        return now.truncatedTo(unit);
    }
}
