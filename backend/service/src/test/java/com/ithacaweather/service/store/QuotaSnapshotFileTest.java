package com.ithacaweather.service.store;

import com.ithacaweather.ingest.quota.QuotaSnapshot;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuotaSnapshotFileTest {
    @Test
    void savesAndReloadsSnapshot() throws Exception {
        Path file = Files.createTempDirectory("quota-state-").resolve("state/quota.json");
        QuotaSnapshot snapshot = new QuotaSnapshot(List.of(
                new QuotaSnapshot.WindowUsage("daily", Instant.parse("2026-03-01T00:00:00Z"), 412),
                new QuotaSnapshot.WindowUsage("perMinute", Instant.parse("2026-03-01T15:04:00Z"), 4)
        ));

        new QuotaSnapshotFile(file).save(snapshot);

        assertEquals(snapshot, new QuotaSnapshotFile(file).load().orElseThrow());
        assertFalse(Files.exists(file.resolveSibling("quota.json.tmp")));
    }

    @Test
    void missingFileLoadsAsEmpty() throws Exception {
        Path file = Files.createTempDirectory("quota-state-").resolve("state/quota.json");

        assertTrue(new QuotaSnapshotFile(file).load().isEmpty());
    }

    @Test
    void corruptFileFailsWithClearMessage() throws Exception {
        Path file = Files.createTempDirectory("quota-state-").resolve("quota.json");
        Files.writeString(file, "{\"windows\": [");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> new QuotaSnapshotFile(file).load());
        assertTrue(error.getMessage().contains("Failed loading quota state"));
    }
}
