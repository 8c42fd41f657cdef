package com.ithacaweather.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ithacaweather.core.util.JsonUtils;
import com.ithacaweather.ingest.quota.QuotaSnapshot;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Quota usage carried across restarts so a restart inside a window cannot overspend it.
 */
public class QuotaSnapshotFile {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public QuotaSnapshotFile(Path file) {
        this.file = file.toAbsolutePath();
    }

    public Optional<QuotaSnapshot> load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            try (InputStream in = Files.newInputStream(file)) {
                return Optional.of(MAPPER.readValue(in, QuotaSnapshot.class));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading quota state from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    public void save(QuotaSnapshot snapshot) {
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, snapshot);
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing quota state to " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
