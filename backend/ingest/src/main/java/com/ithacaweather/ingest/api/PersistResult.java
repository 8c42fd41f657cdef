package com.ithacaweather.ingest.api;

public record PersistResult(int inserted, int skippedDuplicate) {
    public static final PersistResult NOTHING = new PersistResult(0, 0);

    public PersistResult {
        if (inserted < 0 || skippedDuplicate < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
    }
}
