package com.storage.manager.metrics;

import com.storage.manager.core.model.CleanupResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code storage.cleanup.duration} Timer (tag: status)</li>
 *   <li>{@code storage.cleanup.files.removed} Counter</li>
 *   <li>{@code storage.cleanup.bytes.freed} Counter</li>
 *   <li>{@code storage.cleanup.files.failed} Counter</li>
 *   <li>{@code storage.scheduler.dispatch.skipped} Counter</li>
 *   <li>{@code storage.discovery.registrations} Counter (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter filesRemovedCounter;
    private final Counter bytesFreedCounter;
    private final Counter filesFailedCounter;
    private final Counter dispatchSkippedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.filesRemovedCounter = Counter.builder("storage.cleanup.files.removed")
                .description("Number of files deleted by cleanup runs")
                .register(registry);
        this.bytesFreedCounter = Counter.builder("storage.cleanup.bytes.freed")
                .description("Bytes released by cleanup runs")
                .baseUnit("bytes")
                .register(registry);
        this.filesFailedCounter = Counter.builder("storage.cleanup.files.failed")
                .description("Number of files whose deletion failed")
                .register(registry);
        this.dispatchSkippedCounter = Counter.builder("storage.scheduler.dispatch.skipped")
                .description("Runs skipped because the previous run on the same key was still active")
                .register(registry);
    }

    @Override
    public void recordCleanup(CleanupResult result) {
        String status = result.status().wireName();
        Timer timer = timerCache.computeIfAbsent(status, k ->
                Timer.builder("storage.cleanup.duration")
                        .description("Duration of cleanup runs")
                        .tag("status", status)
                        .register(registry));
        timer.record(result.duration());
        filesRemovedCounter.increment(result.filesRemoved());
        bytesFreedCounter.increment(result.bytesFreed());
        filesFailedCounter.increment(result.filesFailed());
    }

    @Override
    public void incrementDispatchSkipped() {
        dispatchSkippedCounter.increment();
    }

    @Override
    public void recordDiscovery(String outcome, int count) {
        if (count <= 0) {
            return;
        }
        Counter counter = counterCache.computeIfAbsent(outcome, k ->
                Counter.builder("storage.discovery.registrations")
                        .description("Label registrations by discovery outcome")
                        .tag("outcome", outcome)
                        .register(registry));
        counter.increment(count);
    }
}
