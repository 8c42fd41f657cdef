package com.ithacaweather.ingest.quota;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Calls remaining under every configured window. One instance is shared by all fetch tasks of
 * the process; every method is synchronized so a check-then-spend can never overspend.
 */
public final class QuotaState {
    private static final Logger LOGGER = Logger.getLogger(QuotaState.class.getName());

    private final Clock clock;
    private final List<QuotaWindow> windows;
    private final Instant[] windowStarts;
    private final long[] used;

    public QuotaState(Clock clock, List<QuotaWindow> windows) {
        if (windows.isEmpty()) {
            throw new IllegalArgumentException("At least one quota window is required");
        }
        this.clock = clock;
        this.windows = List.copyOf(windows);
        this.windowStarts = new Instant[windows.size()];
        this.used = new long[windows.size()];
        Instant now = clock.instant();
        for (int i = 0; i < windows.size(); i++) {
            windowStarts[i] = windows.get(i).windowStart(now);
        }
    }

    /**
     * Reserves one call in every window, or reserves nothing and returns false when any window
     * is spent.
     */
    public synchronized boolean tryAcquire() {
        rollover(clock.instant());
        for (int i = 0; i < windows.size(); i++) {
            if (used[i] >= windows.get(i).limit()) {
                return false;
            }
        }
        for (int i = 0; i < windows.size(); i++) {
            used[i]++;
        }
        return true;
    }

    public synchronized long remaining() {
        rollover(clock.instant());
        long remaining = Long.MAX_VALUE;
        for (int i = 0; i < windows.size(); i++) {
            remaining = Math.min(remaining, windows.get(i).limit() - used[i]);
        }
        return Math.max(0, remaining);
    }

    public synchronized QuotaSnapshot snapshot() {
        rollover(clock.instant());
        List<QuotaSnapshot.WindowUsage> usages = new ArrayList<>();
        for (int i = 0; i < windows.size(); i++) {
            usages.add(new QuotaSnapshot.WindowUsage(windows.get(i).name(), windowStarts[i], used[i]));
        }
        return new QuotaSnapshot(usages);
    }

    /**
     * Re-applies usage recorded before a restart. Entries for unknown windows or for windows that
     * have since rolled over are ignored.
     */
    public synchronized void restore(QuotaSnapshot snapshot) {
        Instant now = clock.instant();
        rollover(now);
        for (QuotaSnapshot.WindowUsage usage : snapshot.windows()) {
            for (int i = 0; i < windows.size(); i++) {
                QuotaWindow window = windows.get(i);
                if (!window.name().equals(usage.name()) || usage.windowStart() == null) {
                    continue;
                }
                if (isSameWindow(window, usage.windowStart(), now)) {
                    used[i] = Math.max(used[i], Math.min(usage.used(), window.limit()));
                    LOGGER.info("Restored " + window.name() + " quota usage: " + used[i] + "/" + window.limit());
                }
            }
        }
    }

    static boolean isSameWindow(QuotaWindow window, Instant recordedStart, Instant now) {
        return window.windowStart(now).equals(window.windowStart(recordedStart));
    }

    private void rollover(Instant now) {
        for (int i = 0; i < windows.size(); i++) {
            QuotaWindow window = windows.get(i);
            if (!isSameWindow(window, windowStarts[i], now)) {
                windowStarts[i] = window.windowStart(now);
                used[i] = 0;
            }
        }
    }
}
