package com.ithacaweather.ingest.orchestrator;

import com.ithacaweather.core.model.Location;
import com.ithacaweather.core.model.Reading;
import com.ithacaweather.ingest.api.PersistResult;

import java.time.Instant;
import java.util.List;

public record CycleResult(
        long cycle,
        Instant startedAt,
        List<Reading> succeeded,
        List<LocationFailure> failed,
        List<Location> deferred,
        PersistResult persisted
) {
    public CycleResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
        deferred = List.copyOf(deferred);
    }

    public boolean fullySucceeded() {
        return failed.isEmpty() && deferred.isEmpty();
    }
}
