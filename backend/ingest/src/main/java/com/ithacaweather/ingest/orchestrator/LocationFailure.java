package com.ithacaweather.ingest.orchestrator;

import com.ithacaweather.core.error.FetchException;
import com.ithacaweather.core.model.Location;

public record LocationFailure(Location location, FetchException error) {
}
