package com.ithacaweather.core.events;

import java.time.Instant;

public record CycleFailed(
        Instant timestamp,
        long cycle,
        String errorClass,
        String message
) implements Event {
    @Override
    public String type() {
        return "CycleFailed";
    }
}
