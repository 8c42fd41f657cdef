package com.ithacaweather.ingest.quota;

import java.time.Instant;
import java.util.List;

public record QuotaSnapshot(List<WindowUsage> windows) {
    public QuotaSnapshot {
        windows = windows == null ? List.of() : List.copyOf(windows);
    }

    public record WindowUsage(String name, Instant windowStart, long used) {
    }
}
