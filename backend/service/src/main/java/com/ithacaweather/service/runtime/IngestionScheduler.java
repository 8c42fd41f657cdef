package com.ithacaweather.service.runtime;

import com.ithacaweather.core.model.Location;
import com.ithacaweather.ingest.orchestrator.CycleResult;
import com.ithacaweather.ingest.orchestrator.LocationFetchOrchestrator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives poll cycles on a fixed start-to-start cadence. At most one cycle is in flight; a cycle
 * that overruns the interval is followed immediately by the next one, never by a queue of them.
 * Missed cycles are not replayed after a restart.
 */
public class IngestionScheduler {
    private static final Logger LOGGER = Logger.getLogger(IngestionScheduler.class.getName());

    public enum State {
        IDLE,
        RUNNING,
        STOPPED
    }

    private final Supplier<CycleResult> cycle;
    private final Runnable stopSignal;
    private final Duration interval;
    private final Duration shutdownGrace;
    private final Clock clock;
    private final ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(
            daemonThreads("ingest-scheduler"));
    private final ExecutorService cycleExecutor = Executors.newSingleThreadExecutor(daemonThreads("ingest-cycle"));
    private final Object lock = new Object();
    private final AtomicLong cyclesStarted = new AtomicLong();
    private final AtomicLong cyclesFailed = new AtomicLong();

    private State state = State.IDLE;
    private boolean started;
    private ScheduledFuture<?> nextTick;
    private CompletableFuture<Void> inFlight = CompletableFuture.completedFuture(null);
    private volatile CycleResult lastResult;

    public IngestionScheduler(
            Supplier<CycleResult> cycle,
            Runnable stopSignal,
            Duration interval,
            Duration shutdownGrace,
            Clock clock
    ) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.cycle = cycle;
        this.stopSignal = stopSignal;
        this.interval = interval;
        this.shutdownGrace = shutdownGrace;
        this.clock = clock;
    }

    public static IngestionScheduler forOrchestrator(
            LocationFetchOrchestrator orchestrator,
            List<Location> locations,
            Duration interval,
            Duration shutdownGrace,
            Clock clock
    ) {
        List<Location> snapshot = List.copyOf(locations);
        return new IngestionScheduler(
                () -> orchestrator.runCycle(snapshot),
                orchestrator::requestStop,
                interval,
                shutdownGrace,
                clock
        );
    }

    public void start() {
        synchronized (lock) {
            if (started) {
                throw new IllegalStateException("Scheduler already started");
            }
            started = true;
        }
        LOGGER.info("Scheduling poll cycles every " + interval);
        scheduleTick(Duration.ZERO);
    }

    /**
     * Cancels the timer, asks in-flight fetches to wrap up, then waits up to the grace period
     * for the running cycle to persist what it has.
     *
     * @return true when no cycle was left running
     */
    public boolean shutdown() {
        CompletableFuture<Void> running;
        synchronized (lock) {
            if (state == State.STOPPED) {
                return true;
            }
            state = State.STOPPED;
            if (nextTick != null) {
                nextTick.cancel(false);
            }
            running = inFlight;
        }
        LOGGER.info("Scheduler stopping; draining in-flight cycle");
        stopSignal.run();
        loop.shutdown();

        boolean drained = true;
        try {
            running.get(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            drained = false;
            LOGGER.warning("In-flight cycle did not finish within " + shutdownGrace);
        } catch (ExecutionException e) {
            LOGGER.log(Level.WARNING, "In-flight cycle ended with an error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        cycleExecutor.shutdown();
        return drained;
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    public long cyclesStarted() {
        return cyclesStarted.get();
    }

    public long cyclesFailed() {
        return cyclesFailed.get();
    }

    public CycleResult lastResult() {
        return lastResult;
    }

    /**
     * Delay from the end of a cycle to the start of the next: what is left of the interval
     * measured from this cycle's start, or zero when the cycle overran.
     */
    static Duration nextDelay(Instant cycleStartedAt, Instant cycleFinishedAt, Duration interval) {
        Duration remaining = interval.minus(Duration.between(cycleStartedAt, cycleFinishedAt));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void scheduleTick(Duration delay) {
        synchronized (lock) {
            if (state == State.STOPPED) {
                return;
            }
            try {
                nextTick = loop.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                LOGGER.log(Level.FINE, "Timer already shut down; not scheduling another cycle", e);
            }
        }
    }

    private void tick() {
        Instant startedAt;
        CompletableFuture<Void> running;
        synchronized (lock) {
            if (state != State.IDLE) {
                return;
            }
            state = State.RUNNING;
            startedAt = clock.instant();
            cyclesStarted.incrementAndGet();
            running = CompletableFuture.runAsync(this::runCycleSafely, cycleExecutor);
            inFlight = running;
        }
        running.whenComplete((ignored, error) -> onCycleFinished(startedAt));
    }

    private void runCycleSafely() {
        try {
            lastResult = cycle.get();
        } catch (RuntimeException e) {
            cyclesFailed.incrementAndGet();
            LOGGER.log(Level.SEVERE, "Poll cycle failed; next cycle will run on schedule", e);
        }
    }

    private void onCycleFinished(Instant startedAt) {
        Duration delay = nextDelay(startedAt, clock.instant(), interval);
        synchronized (lock) {
            if (state != State.RUNNING) {
                return;
            }
            state = State.IDLE;
        }
        if (delay.isZero()) {
            LOGGER.warning("Poll cycle overran the " + interval + " interval; starting the next one now");
        }
        scheduleTick(delay);
    }

    private static ThreadFactory daemonThreads(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
