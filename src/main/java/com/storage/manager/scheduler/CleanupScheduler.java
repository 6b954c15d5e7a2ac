package com.storage.manager.scheduler;

import com.storage.manager.core.exception.StorageManagerException;
import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.Registration;
import com.storage.manager.core.model.RegistrationKey;
import com.storage.manager.logging.LogContext;
import com.storage.manager.metrics.MetricsService;
import com.storage.manager.metrics.NoOpMetricsService;
import com.storage.manager.registry.RegistryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically runs every registration's cleanup on a bounded worker pool.
 *
 * <p>Each tick takes a registry snapshot and dispatches one run per registration whose
 * key is free in the {@link KeyLockTable}. A key still held by an earlier run is
 * skipped for that tick, never queued. A run exceeding the configured timeout is
 * recorded as TIMED_OUT and its worker is interrupted; the key stays locked until the
 * worker actually returns.</p>
 */
public class CleanupScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CleanupScheduler.class);

    private final RegistryService registry;
    private final CleanupRunner runner;
    private final SchedulerConfig config;
    private final MetricsService metrics;
    private final Clock clock;

    private final KeyLockTable locks = new KeyLockTable();
    private final Map<RegistrationKey, RunState> states = new ConcurrentHashMap<>();
    private final ScheduledExecutorService ticker;
    private final ScheduledExecutorService watchdog;
    private final ExecutorService workers;
    private final Object tickLock = new Object();

    private volatile boolean running;
    private volatile boolean stopped;
    private volatile Instant lastTickAt;
    private volatile Instant startedAt;

    public CleanupScheduler(RegistryService registry, CleanupRunner runner, SchedulerConfig config) {
        this(registry, runner, config, new NoOpMetricsService(), Clock.systemUTC());
    }

    public CleanupScheduler(RegistryService registry, CleanupRunner runner, SchedulerConfig config,
                            MetricsService metrics, Clock clock) {
        this.registry = registry;
        this.runner = runner;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.ticker = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("sm-tick"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("sm-watchdog"));
        this.workers = Executors.newFixedThreadPool(config.workerThreads(), new NamedThreadFactory("sm-worker"));
    }

    /**
     * Starts periodic ticking. A stopped scheduler cannot be restarted.
     */
    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("Scheduler has been stopped");
        }
        if (running) {
            return;
        }
        ticker.scheduleWithFixedDelay(this::tickSafely, config.initialDelay().toMillis(),
                config.checkInterval().toMillis(), TimeUnit.MILLISECONDS);
        running = true;
        startedAt = clock.instant();
        log.info("scheduler.started intervalSeconds={} workers={} runTimeoutSeconds={}",
                config.checkInterval().toSeconds(), config.workerThreads(), config.runTimeout().toSeconds());
    }

    /**
     * Stops ticking, waits up to the grace period for in-flight runs and then interrupts them.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        running = false;
        stopped = true;
        ticker.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> abandoned = workers.shutdownNow();
                log.warn("scheduler.stop.graceExpired inFlight={} queued={}", locks.size(), abandoned.size());
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        watchdog.shutdownNow();
        log.info("scheduler.stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Runs one tick synchronously and waits until every run it dispatched has returned.
     */
    public TickReport runOnce() {
        List<CompletableFuture<Void>> completions = new ArrayList<>();
        TickReport report = tick(completions);
        CompletableFuture.allOf(completions.toArray(new CompletableFuture[0])).join();
        return report;
    }

    public boolean isRunning() {
        return running;
    }

    public Instant lastTickAt() {
        return lastTickAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public SchedulerConfig config() {
        return config;
    }

    /**
     * Current state of a registration. Keys never dispatched are IDLE.
     */
    public RunState runState(RegistrationKey key) {
        return states.getOrDefault(key, RunState.IDLE);
    }

    public boolean isLocked(RegistrationKey key) {
        return locks.isLocked(key);
    }

    private void tickSafely() {
        try {
            tick(null);
        } catch (RuntimeException e) {
            log.error("scheduler.tick.failed error={}", e.getMessage(), e);
        }
    }

    private TickReport tick(List<CompletableFuture<Void>> completions) {
        synchronized (tickLock) {
            Instant tickStart = clock.instant();
            lastTickAt = tickStart;
            List<Registration> snapshot = registry.snapshot();
            List<RegistrationKey> dispatched = new ArrayList<>();
            List<RegistrationKey> skipped = new ArrayList<>();

            for (Registration registration : snapshot) {
                RegistrationKey key = registration.key();
                if (!locks.tryAcquire(key)) {
                    log.info("scheduler.skipped key={} reason=previous-run-active", key);
                    metrics.incrementDispatchSkipped();
                    skipped.add(key);
                    continue;
                }
                CompletableFuture<Void> done = dispatch(registration);
                if (completions != null) {
                    completions.add(done);
                }
                dispatched.add(key);
            }
            forgetRemoved(snapshot);
            log.debug("scheduler.tick registrations={} dispatched={} skipped={}",
                    snapshot.size(), dispatched.size(), skipped.size());
            return new TickReport(tickStart, dispatched, skipped);
        }
    }

    private CompletableFuture<Void> dispatch(Registration registration) {
        RegistrationKey key = registration.key();
        CompletableFuture<Void> done = new CompletableFuture<>();
        states.put(key, RunState.RUNNING);
        try {
            workers.execute(() -> {
                try {
                    execute(registration);
                } finally {
                    locks.release(key);
                    done.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            locks.release(key);
            states.put(key, RunState.IDLE);
            log.warn("scheduler.dispatch.rejected key={} reason=shutting-down", key);
            done.complete(null);
        }
        return done;
    }

    private void execute(Registration registration) {
        RegistrationKey key = registration.key();
        String runId = LogContext.generateRunId();
        RunHandle handle = new RunHandle(Thread.currentThread());
        try (LogContext ctx = LogContext.forRun(runId, key).with("algorithm", registration.algorithm())) {
            log.info("cleanup.started");
            ScheduledFuture<?> timer = scheduleTimeout(handle, key, runId);
            Instant runStart = clock.instant();
            CleanupResult result;
            try {
                result = runner.run(registration);
            } catch (RuntimeException e) {
                log.error("cleanup.runnerFailed error={}", e.getMessage(), e);
                result = CleanupResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage(),
                        Duration.between(runStart, clock.instant()), clock.instant());
            } finally {
                if (timer != null) {
                    timer.cancel(false);
                }
            }
            if (handle.complete()) {
                record(key, result);
                log.info("cleanup.completed result={}", result);
            } else {
                log.warn("cleanup.lateResult result={} reason=timed-out", result);
            }
        } finally {
            Thread.interrupted();
        }
    }

    private ScheduledFuture<?> scheduleTimeout(RunHandle handle, RegistrationKey key, String runId) {
        Duration timeout = config.runTimeout();
        try {
            return watchdog.schedule(() -> {
                if (handle.timeOut()) {
                    try (LogContext ctx = LogContext.forRun(runId, key)) {
                        log.warn("cleanup.timedOut timeoutSeconds={}", timeout.toSeconds());
                        record(key, CleanupResult.timedOut(timeout, clock.instant()));
                    }
                    handle.interruptIfRunning();
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("scheduler.watchdog.unavailable key={}", key);
            return null;
        }
    }

    private void record(RegistrationKey key, CleanupResult result) {
        states.put(key, RunState.of(result.status()));
        metrics.recordCleanup(result);
        try {
            registry.recordResult(key, result);
        } catch (StorageManagerException e) {
            log.error("cleanup.resultNotPersisted key={} error={}", key, e.getMessage());
        }
    }

    private void forgetRemoved(List<Registration> snapshot) {
        Set<RegistrationKey> live = new HashSet<>();
        snapshot.forEach(r -> live.add(r.key()));
        states.keySet().removeIf(key -> !live.contains(key) && !locks.isLocked(key));
    }

    /**
     * Arbitrates between the worker finishing and the watchdog firing, so exactly one
     * of them records a result and an interrupt never reaches a worker that has moved on.
     * A timed-out result is recorded before the worker is interrupted.
     */
    private static final class RunHandle {
        private final Thread worker;
        private boolean finished;
        private boolean timedOut;

        RunHandle(Thread worker) {
            this.worker = worker;
        }

        /**
         * @return true if the worker's own result should be recorded
         */
        synchronized boolean complete() {
            finished = true;
            return !timedOut;
        }

        /**
         * @return true if the timeout won and should be recorded
         */
        synchronized boolean timeOut() {
            if (finished) {
                return false;
            }
            timedOut = true;
            return true;
        }

        /**
         * Interrupts the worker unless it has already returned from the run.
         */
        synchronized void interruptIfRunning() {
            if (!finished) {
                worker.interrupt();
            }
        }
    }
}
