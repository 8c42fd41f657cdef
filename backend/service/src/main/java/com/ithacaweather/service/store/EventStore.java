package com.ithacaweather.service.store;

import com.ithacaweather.core.events.Event;

import java.util.List;

/**
 * Durable record of pipeline events, read back oldest first.
 */
public interface EventStore {
    void append(Event event);

    /**
     * The newest {@code query.limit()} matching events, in the order they were appended.
     */
    List<Event> query(EventQuery query);
}
