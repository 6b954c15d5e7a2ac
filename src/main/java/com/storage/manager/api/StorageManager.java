package com.storage.manager.api;

import com.storage.manager.algorithm.AlgorithmCatalog;
import com.storage.manager.algorithm.AlgorithmType;
import com.storage.manager.algorithm.CleanupAlgorithm;
import com.storage.manager.algorithm.FileDeleter;
import com.storage.manager.core.exception.NotFoundException;
import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.core.model.Registration;
import com.storage.manager.core.model.RegistrationDraft;
import com.storage.manager.core.model.RegistrationKey;
import com.storage.manager.discovery.DiscoveryReconciler;
import com.storage.manager.discovery.LabelParser;
import com.storage.manager.discovery.SweepReport;
import com.storage.manager.health.ContainerRuntimeHealthCheck;
import com.storage.manager.health.HealthCheckRegistry;
import com.storage.manager.health.HealthStatus;
import com.storage.manager.health.SchedulerHealthCheck;
import com.storage.manager.listing.VolumeListingService;
import com.storage.manager.listing.VolumeQuery;
import com.storage.manager.listing.VolumeSummary;
import com.storage.manager.metrics.MetricsService;
import com.storage.manager.metrics.NoOpMetricsService;
import com.storage.manager.registry.InMemoryRegistrationStore;
import com.storage.manager.registry.JsonFileRegistrationStore;
import com.storage.manager.registry.RegistrationFilter;
import com.storage.manager.registry.RegistrationStore;
import com.storage.manager.registry.RegistryService;
import com.storage.manager.scheduler.CleanupRunner;
import com.storage.manager.scheduler.CleanupScheduler;
import com.storage.manager.scheduler.TickReport;
import com.storage.manager.volume.ContainerRuntime;
import com.storage.manager.volume.UsageCache;
import com.storage.manager.volume.VolumeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point: wires the registry, discovery, scheduler, listing and health
 * components around one container runtime.
 *
 * <pre>
 * try (StorageManager manager = StorageManager.builder()
 *         .containerRuntime(DockerEngineClient.builder().baseUrl("http://localhost:2375").build())
 *         .registryFile(Path.of("/data/storage_manager.json"))
 *         .build()) {
 *     manager.start();
 *     manager.register(new RegistrationDraft("app_logs", "/", "max_size", Map.of("max_bytes", 1_000_000), null));
 * }
 * </pre>
 */
public class StorageManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StorageManager.class);

    private final ContainerRuntime runtime;
    private final AlgorithmCatalog algorithms;
    private final RegistryService registry;
    private final DiscoveryReconciler discovery;
    private final CleanupScheduler scheduler;
    private final VolumeListingService listing;
    private final HealthCheckRegistry healthChecks;
    private final StorageManagerOptions options;
    private volatile boolean started;

    private StorageManager(Builder builder) {
        this.runtime = Objects.requireNonNull(builder.runtime, "containerRuntime is required");
        this.options = builder.options;
        Clock clock = builder.clock;
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        RegistrationStore store = builder.store != null ? builder.store : new InMemoryRegistrationStore();

        this.algorithms = AlgorithmType.catalog(clock);
        this.registry = new RegistryService(store, algorithms, clock);

        VolumeResolver resolver = new VolumeResolver(runtime);
        this.discovery = new DiscoveryReconciler(runtime, new LabelParser(options.getLabelPrefix(), algorithms),
                registry, metrics, clock);
        CleanupRunner runner = new CleanupRunner(algorithms, resolver, builder.fileDeleter, clock);
        this.scheduler = new CleanupScheduler(registry, runner, options.schedulerConfig(), metrics, clock);
        this.listing = new VolumeListingService(resolver, registry,
                new UsageCache(options.getUsageCacheTtl(), options.getUsageCacheMaxSize()));

        this.healthChecks = new HealthCheckRegistry();
        healthChecks.register(new SchedulerHealthCheck(scheduler, registry, clock));
        healthChecks.register(new ContainerRuntimeHealthCheck(runtime));

        log.info("StorageManager initialized: store={} runtime={}", store.describe(), runtime.describe());
    }

    /**
     * Starts label discovery (when enabled) and the cleanup scheduler.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        if (options.isDiscoveryEnabled()) {
            discovery.start(options.getDiscoveryInterval());
        }
        scheduler.start();
        started = true;
    }

    // ========== Registration API ==========

    /**
     * Registers a target with API provenance, replacing any registration on the same key.
     *
     * @throws com.storage.manager.core.exception.ValidationException for a bad path,
     *         unknown algorithm or invalid parameters
     * @throws NotFoundException if the runtime is reachable and does not know the volume
     */
    public Registration register(RegistrationDraft draft) {
        RegistrationKey key = RegistrationKey.of(draft.volumeName(), draft.path());
        CleanupAlgorithm algorithm = algorithms.get(draft.algorithm());
        algorithm.validate(draft.params());
        requireKnownVolume(key.volumeName());
        return registry.register(draft);
    }

    /**
     * Removes a registration regardless of provenance.
     *
     * @throws NotFoundException if nothing is registered under the key
     */
    public void unregister(String volumeName, String path) {
        RegistrationKey key = RegistrationKey.of(volumeName, path);
        if (!registry.remove(key)) {
            throw new NotFoundException("Registration not found: " + key);
        }
    }

    public Optional<Registration> registration(String volumeName, String path) {
        return registry.get(RegistrationKey.of(volumeName, path));
    }

    public List<Registration> registrations(RegistrationFilter filter) {
        return registry.list(filter);
    }

    public List<VolumeSummary> volumes(VolumeQuery query) {
        return listing.list(query);
    }

    public HealthStatus health() {
        return healthChecks.checkAll();
    }

    // ========== Manual triggers ==========

    /**
     * Runs one discovery sweep now.
     */
    public SweepReport sweep() {
        return discovery.sweep();
    }

    /**
     * Runs one cleanup tick now and waits for its runs.
     */
    public TickReport runOnce() {
        return scheduler.runOnce();
    }

    public RegistryService getRegistry() {
        return registry;
    }

    public CleanupScheduler getScheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        discovery.stop();
        scheduler.stop();
        log.info("StorageManager closed");
    }

    private void requireKnownVolume(String volumeName) {
        try {
            if (runtime.inspectVolume(volumeName).isEmpty()) {
                throw new NotFoundException("Unknown volume: " + volumeName);
            }
        } catch (TransientInfraException e) {
            log.warn("register.volumeUnchecked volume={} reason={}", volumeName, e.getMessage());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ContainerRuntime runtime;
        private RegistrationStore store;
        private StorageManagerOptions options = StorageManagerOptions.defaults();
        private MetricsService metricsService;
        private FileDeleter fileDeleter = FileDeleter.defaultDeleter();
        private Clock clock = Clock.systemUTC();

        public Builder containerRuntime(ContainerRuntime runtime) {
            this.runtime = runtime;
            return this;
        }

        /**
         * Persists registrations to a JSON file, creating it on first write.
         */
        public Builder registryFile(Path file) {
            this.store = new JsonFileRegistrationStore(file);
            return this;
        }

        /**
         * Uses a custom store. Defaults to a non-durable in-memory store.
         */
        public Builder store(RegistrationStore store) {
            this.store = store;
            return this;
        }

        public Builder options(StorageManagerOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder fileDeleter(FileDeleter fileDeleter) {
            this.fileDeleter = fileDeleter;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws com.storage.manager.core.exception.RegistryCorruptedException if the
         *         store exists but cannot be loaded
         */
        public StorageManager build() {
            return new StorageManager(this);
        }
    }
}
