package com.storage.manager.discovery;

import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.Registration;
import com.storage.manager.core.model.RegistrationKey;
import com.storage.manager.logging.LogContext;
import com.storage.manager.metrics.MetricsService;
import com.storage.manager.metrics.NoOpMetricsService;
import com.storage.manager.registry.RegistryService;
import com.storage.manager.scheduler.NamedThreadFactory;
import com.storage.manager.volume.ContainerInfo;
import com.storage.manager.volume.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps LABEL registrations in step with the labels currently declared on containers.
 *
 * <p>Each sweep lists every container (stopped ones included), parses its labels and
 * upserts the valid drafts. A draft whose key is held by an API registration, or was
 * already claimed by an earlier container in the same sweep, is discarded. LABEL
 * registrations not observed in the sweep are removed. API registrations are never
 * touched. If the runtime cannot be listed, nothing is pruned.</p>
 */
public class DiscoveryReconciler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryReconciler.class);

    private final ContainerRuntime runtime;
    private final LabelParser parser;
    private final RegistryService registry;
    private final MetricsService metrics;
    private final Clock clock;
    private final Object sweepLock = new Object();
    private ScheduledExecutorService executor;
    private volatile SweepReport lastReport;

    public DiscoveryReconciler(ContainerRuntime runtime, LabelParser parser, RegistryService registry) {
        this(runtime, parser, registry, new NoOpMetricsService(), Clock.systemUTC());
    }

    public DiscoveryReconciler(ContainerRuntime runtime, LabelParser parser, RegistryService registry,
                               MetricsService metrics, Clock clock) {
        this.runtime = runtime;
        this.parser = parser;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs one sweep synchronously.
     *
     * @throws TransientInfraException if the container runtime cannot be listed; the
     *                                 registry is left unchanged
     */
    public SweepReport sweep() {
        synchronized (sweepLock) {
            try (LogContext ctx = LogContext.forSweep(LogContext.generateRunId())) {
                return doSweep();
            }
        }
    }

    private SweepReport doSweep() {
        Instant start = clock.instant();
        List<ContainerInfo> containers;
        try {
            containers = new ArrayList<>(runtime.listContainers());
        } catch (TransientInfraException e) {
            metrics.recordDiscovery("failed", 1);
            log.warn("discovery.aborted runtime={} error={}", runtime.describe(), e.getMessage());
            throw e;
        }
        containers.sort(Comparator.comparing(ContainerInfo::name).thenComparing(ContainerInfo::id));

        Set<RegistrationKey> observed = new HashSet<>();
        List<LabelParseResult.Rejection> rejected = new ArrayList<>();
        int applied = 0;
        int discarded = 0;

        for (ContainerInfo container : containers) {
            LabelParseResult result = parser.parse(container);
            rejected.addAll(result.rejections());
            for (LabelParseResult.Discovered discovered : result.drafts()) {
                RegistrationKey key = RegistrationKey.of(discovered.draft().volumeName(), discovered.draft().path());
                if (!observed.add(key)) {
                    log.warn("discovery.duplicate key={} container={} index={}",
                            key, container.name(), discovered.index());
                    discarded++;
                    continue;
                }
                try {
                    if (registry.upsertDiscovered(discovered.draft())) {
                        applied++;
                    } else {
                        discarded++;
                    }
                } catch (ValidationException e) {
                    rejected.add(new LabelParseResult.Rejection(discovered.index(), container.name(), e.getMessage()));
                }
            }
        }

        List<RegistrationKey> pruned = registry.removeStaleDiscovered(observed).stream()
                .map(Registration::key)
                .toList();

        metrics.recordDiscovery("applied", applied);
        metrics.recordDiscovery("discarded", discarded);
        metrics.recordDiscovery("rejected", rejected.size());
        metrics.recordDiscovery("pruned", pruned.size());

        SweepReport report = new SweepReport(containers.size(), applied, discarded, rejected, pruned,
                Duration.between(start, clock.instant()));
        lastReport = report;
        log.info("discovery.completed report={}", report);
        return report;
    }

    /**
     * Sweeps now and then every {@code interval}. Failed sweeps are logged and retried
     * on the next interval.
     */
    public synchronized void start(Duration interval) {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("sm-discovery"));
        executor.scheduleWithFixedDelay(this::sweepSafely, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("discovery.started intervalSeconds={}", interval.toSeconds());
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("discovery.stop.timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("discovery.stopped");
    }

    public SweepReport lastReport() {
        return lastReport;
    }

    @Override
    public void close() {
        stop();
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (TransientInfraException e) {
            log.debug("discovery.retryScheduled error={}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("discovery.failed error={}", e.getMessage(), e);
        }
    }
}
