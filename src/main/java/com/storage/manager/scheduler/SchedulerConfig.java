package com.storage.manager.scheduler;

import java.time.Duration;

/**
 * Configuration for {@link CleanupScheduler}.
 *
 * @param checkInterval  fixed delay between ticks
 * @param initialDelay   delay before the first tick after {@code start()}
 * @param runTimeout     maximum duration of a single cleanup run
 * @param workerThreads  size of the bounded worker pool
 * @param shutdownGrace  how long {@code stop()} waits for in-flight runs
 */
public record SchedulerConfig(Duration checkInterval, Duration initialDelay, Duration runTimeout,
                              int workerThreads, Duration shutdownGrace) {

    public SchedulerConfig {
        requirePositive(checkInterval, "checkInterval");
        requirePositive(runTimeout, "runTimeout");
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (shutdownGrace == null || shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must be >= 0");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
    }

    /**
     * Default configuration: 300s interval, 10s initial delay, 600s run timeout,
     * 4 workers, 30s shutdown grace.
     */
    public static SchedulerConfig defaults() {
        return new SchedulerConfig(Duration.ofSeconds(300), Duration.ofSeconds(10), Duration.ofSeconds(600),
                4, Duration.ofSeconds(30));
    }

    public SchedulerConfig withCheckInterval(Duration interval) {
        return new SchedulerConfig(interval, initialDelay, runTimeout, workerThreads, shutdownGrace);
    }

    public SchedulerConfig withRunTimeout(Duration timeout) {
        return new SchedulerConfig(checkInterval, initialDelay, timeout, workerThreads, shutdownGrace);
    }

    public SchedulerConfig withWorkerThreads(int threads) {
        return new SchedulerConfig(checkInterval, initialDelay, runTimeout, threads, shutdownGrace);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
