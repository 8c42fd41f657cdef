package com.ithacaweather.ingest.api;

import com.ithacaweather.core.error.FetchException;
import com.ithacaweather.core.model.Location;
import com.ithacaweather.core.model.Reading;

public interface WeatherApiClient {
    Reading fetch(Location location) throws FetchException;
}
