package com.ithacaweather.service.store;

import com.ithacaweather.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Append-only audit log of pipeline events, one JSON document per line.
 * A process killed mid-append can leave a torn final line; queries skip it. A bad line
 * anywhere else means the log is corrupt and fails the query.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file.toAbsolutePath();
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(EventQuery query) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            Deque<Event> newest = new ArrayDeque<>(Math.min(query.limit(), 1024));
            RuntimeException pendingDecodeError = null;
            int pendingLine = 0;
            int lineNumber = 0;
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    if (pendingDecodeError != null) {
                        throw new IllegalStateException("Invalid JSONL event at line " + pendingLine, pendingDecodeError);
                    }
                    Event event;
                    try {
                        event = EventCodec.fromJsonLine(line);
                    } catch (RuntimeException decodeError) {
                        pendingDecodeError = decodeError;
                        pendingLine = lineNumber;
                        continue;
                    }
                    if (!query.matches(event)) {
                        continue;
                    }
                    if (newest.size() == query.limit()) {
                        newest.removeFirst();
                    }
                    newest.addLast(event);
                }
            }
            if (pendingDecodeError != null) {
                LOGGER.warning("Skipping torn final event at line " + pendingLine + " of " + file);
            }
            return new ArrayList<>(newest);
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events", e);
        } finally {
            lock.unlock();
        }
    }
}
