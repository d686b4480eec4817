package com.fxscreenreader.services;

import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.utilitymodels.Constants;
import com.fxscreenreader.utilitymodels.Pref;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs polling cycles one after another on a single thread. The next cycle is scheduled only once
 * the previous one has finished, so cycles never overlap. A failing cycle backs off 1, 2, 4, 8 and
 * then 15 minutes; the first success returns to the normal interval.
 */
public class PollingScheduler {

    private static final String TAG = PollingScheduler.class.getSimpleName();

    public static final String PREF_INTERVAL = "reading_interval_minutes";
    static final long DEFAULT_INTERVAL_MS = 5 * Constants.MINUTE_IN_MS;
    static final long BACKOFF_START_MS = Constants.MINUTE_IN_MS;
    static final long BACKOFF_MAX_MS = 15 * Constants.MINUTE_IN_MS;

    private final Callable<?> cycle;
    private final long intervalMs;
    private final ScheduledExecutorService executor;

    private volatile boolean running;
    private volatile ScheduledFuture<?> pending;
    private int consecutiveFailures;
    private long cycles;

    public PollingScheduler(final Callable<?> cycle) {
        this(cycle, Pref.getLong(PREF_INTERVAL, 5) * Constants.MINUTE_IN_MS);
    }

    public PollingScheduler(final Callable<?> cycle, final long intervalMs) {
        this(cycle, intervalMs, Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, "fxreader-poll");
            thread.setDaemon(true);
            return thread;
        }));
    }

    PollingScheduler(final Callable<?> cycle, final long intervalMs, final ScheduledExecutorService executor) {
        this.cycle = cycle;
        if (intervalMs <= 0) {
            UserError.Log.w(TAG, "Invalid polling interval " + intervalMs + " using default");
        }
        this.intervalMs = intervalMs > 0 ? intervalMs : DEFAULT_INTERVAL_MS;
        this.executor = executor;
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        UserError.Log.i(TAG, "Polling every " + JoH.niceTimeScalar(intervalMs));
        schedule(0);
    }

    // the executor is shut down outside the lock so a cycle in flight can finish
    public void stop() {
        synchronized (this) {
            running = false;
            final ScheduledFuture<?> future = pending;
            if (future != null) {
                future.cancel(false);
            }
        }
        shutdown(executor);
        UserError.Log.i(TAG, "Polling stopped after " + getCycles() + " cycles");
    }

    public boolean isRunning() {
        return running;
    }

    synchronized long getCycles() {
        return cycles;
    }

    private synchronized void schedule(final long delayMs) {
        if (!running) return;
        pending = executor.schedule(this::runOnce, delayMs, TimeUnit.MILLISECONDS);
    }

    private void runOnce() {
        long delay;
        try {
            cycle.call();
            consecutiveFailures = 0;
            delay = intervalMs;
        } catch (Exception e) {
            consecutiveFailures++;
            delay = backoff(consecutiveFailures);
            UserError.Log.e(TAG, "Polling cycle failed (" + consecutiveFailures + " in a row), next try in "
                    + JoH.niceTimeScalar(delay) + ": " + e);
        }
        synchronized (this) {
            cycles++;
        }
        schedule(delay);
    }

    static long backoff(final int failures) {
        if (failures <= 0) return BACKOFF_START_MS;
        final int shift = Math.min(failures - 1, 10);
        return Math.min(BACKOFF_START_MS << shift, BACKOFF_MAX_MS);
    }

    private static void shutdown(final ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
