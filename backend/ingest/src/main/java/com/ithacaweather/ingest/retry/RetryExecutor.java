package com.ithacaweather.ingest.retry;

import com.ithacaweather.core.bus.EventBus;
import com.ithacaweather.core.error.FetchException;
import com.ithacaweather.core.events.FetchRetryScheduled;
import com.ithacaweather.core.model.Location;
import com.ithacaweather.core.model.Reading;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.logging.Logger;

/**
 * Runs one logical fetch with bounded retries. Attempts run on the worker executor and the
 * backoff wait is a timer callback, so a sleeping retry never occupies a worker thread.
 */
public final class RetryExecutor {
    private static final Logger LOGGER = Logger.getLogger(RetryExecutor.class.getName());

    private final RetryPolicy policy;
    private final ScheduledExecutorService timer;
    private final Executor workers;
    private final EventBus eventBus;
    private final Clock clock;
    private final DoubleSupplier random;
    private final Set<PendingRetry> pendingRetries = ConcurrentHashMap.newKeySet();
    private volatile boolean stopping;

    public RetryExecutor(
            RetryPolicy policy,
            ScheduledExecutorService timer,
            Executor workers,
            EventBus eventBus,
            Clock clock
    ) {
        this(policy, timer, workers, eventBus, clock, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryExecutor(
            RetryPolicy policy,
            ScheduledExecutorService timer,
            Executor workers,
            EventBus eventBus,
            Clock clock,
            DoubleSupplier random
    ) {
        this.policy = policy;
        this.timer = timer;
        this.workers = workers;
        this.eventBus = eventBus;
        this.clock = clock;
        this.random = random;
    }

    @FunctionalInterface
    public interface FetchCall {
        Reading call() throws FetchException;
    }

    /**
     * Completes with the reading, or exceptionally with the first non-retryable
     * {@link FetchException}, or with a {@code RETRIES_EXHAUSTED} one wrapping the last failure.
     */
    public CompletableFuture<Reading> execute(Location location, FetchCall call) {
        CompletableFuture<Reading> result = new CompletableFuture<>();
        submit(FetchAttempt.first(location), call, result);
        return result;
    }

    /**
     * Stops scheduling new attempts. Chains waiting out a backoff finish now with their last
     * error; attempts already running are left to complete.
     */
    public void stop() {
        stopping = true;
        for (PendingRetry pending : pendingRetries) {
            abandon(pending);
        }
    }

    public boolean isStopping() {
        return stopping;
    }

    int pendingRetryCount() {
        return pendingRetries.size();
    }

    private void submit(FetchAttempt attempt, FetchCall call, CompletableFuture<Reading> result) {
        try {
            workers.execute(() -> run(attempt, call, result));
        } catch (RejectedExecutionException e) {
            FetchException last = attempt.lastError();
            if (last != null) {
                result.completeExceptionally(FetchException.retriesExhausted(last, attempt.attempt() - 1));
            } else {
                result.completeExceptionally(e);
            }
        }
    }

    private void run(FetchAttempt attempt, FetchCall call, CompletableFuture<Reading> result) {
        try {
            result.complete(call.call());
        } catch (FetchException e) {
            try {
                onFailure(attempt.failed(e), call, result);
            } catch (RuntimeException scheduleError) {
                scheduleError.addSuppressed(e);
                result.completeExceptionally(scheduleError);
            }
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    private void onFailure(FetchAttempt attempt, FetchCall call, CompletableFuture<Reading> result) {
        FetchException error = attempt.lastError();
        String locationId = attempt.location().id();
        if (!error.errorClass().retryable()) {
            result.completeExceptionally(error);
            return;
        }
        if (attempt.attempt() >= policy.maxAttempts()) {
            result.completeExceptionally(FetchException.retriesExhausted(error, attempt.attempt()));
            return;
        }
        if (stopping) {
            LOGGER.info("Not retrying " + locationId + " during shutdown");
            result.completeExceptionally(FetchException.retriesExhausted(error, attempt.attempt()));
            return;
        }
        if (policy.exceedsRetryAfterLimit(error)) {
            LOGGER.warning("Provider asked " + locationId + " to wait " + error.retryAfter().get()
                    + ", longer than " + policy.maxRetryAfter() + "; leaving it for the next cycle");
            result.completeExceptionally(FetchException.retriesExhausted(error, attempt.attempt()));
            return;
        }

        Duration delay = policy.delayFor(error, attempt.attempt(), random.getAsDouble());
        FetchAttempt next = attempt.retryAt(clock.instant().plus(delay));
        LOGGER.warning("Attempt " + attempt.attempt() + " for " + locationId + " failed ("
                + error.errorClass() + "): " + error.getMessage() + "; retrying in " + delay.toMillis() + "ms");
        eventBus.publish(new FetchRetryScheduled(
                clock.instant(),
                locationId,
                next.attempt(),
                error.errorClass().name(),
                delay.toMillis()
        ));

        PendingRetry pending = new PendingRetry(next, result);
        pendingRetries.add(pending);
        try {
            pending.future = timer.schedule(() -> {
                if (pendingRetries.remove(pending)) {
                    submit(next, call, result);
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            abandon(pending);
            return;
        }
        if (stopping) {
            abandon(pending);
        }
    }

    private void abandon(PendingRetry pending) {
        if (!pendingRetries.remove(pending)) {
            return;
        }
        ScheduledFuture<?> future = pending.future;
        if (future != null) {
            future.cancel(false);
        }
        FetchAttempt attempt = pending.attempt;
        pending.result.completeExceptionally(
                FetchException.retriesExhausted(attempt.lastError(), attempt.attempt() - 1));
    }

    private static final class PendingRetry {
        private final FetchAttempt attempt;
        private final CompletableFuture<Reading> result;
        private volatile ScheduledFuture<?> future;

        private PendingRetry(FetchAttempt attempt, CompletableFuture<Reading> result) {
            this.attempt = attempt;
            this.result = result;
        }
    }
}
