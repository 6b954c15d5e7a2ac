package com.storage.manager.cdi;

import com.storage.manager.api.StorageManager;
import com.storage.manager.api.StorageManagerOptions;
import com.storage.manager.metrics.MetricsService;
import com.storage.manager.metrics.MicrometerMetricsService;
import com.storage.manager.metrics.NoOpMetricsService;
import com.storage.manager.volume.DockerEngineClient;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * CDI producer that wires a started {@link StorageManager} from MicroProfile Config.
 *
 * <p>Property names use the {@code sm.} prefix, so environment variables such as
 * {@code SM_CHECK_INTERVAL_SECONDS} or {@code SM_DB_PATH} override them directly.
 * A corrupt registry file makes the producer throw and the application refuses to start.</p>
 */
@ApplicationScoped
public class StorageManagerProducer {

    private static final Logger log = LoggerFactory.getLogger(StorageManagerProducer.class);

    // ── Scheduler ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sm.check-interval-seconds", defaultValue = "300")
    long checkIntervalSeconds;

    @Inject
    @ConfigProperty(name = "sm.run-timeout-seconds", defaultValue = "600")
    long runTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "sm.worker-threads", defaultValue = "4")
    int workerThreads;

    // ── Discovery ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sm.discovery-interval-seconds", defaultValue = "300")
    long discoveryIntervalSeconds;

    @Inject
    @ConfigProperty(name = "sm.label-prefix", defaultValue = "storage-manager")
    String labelPrefix;

    // ── Storage and runtime ───────────────────────────────────

    @Inject
    @ConfigProperty(name = "sm.db-path", defaultValue = "/data/storage_manager.json")
    String dbPath;

    @Inject
    @ConfigProperty(name = "sm.docker-host", defaultValue = "http://localhost:2375")
    String dockerHost;

    @Inject
    @ConfigProperty(name = "sm.docker-timeout-seconds", defaultValue = "10")
    long dockerTimeoutSeconds;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Produces
    @ApplicationScoped
    public StorageManager storageManager() {
        log.info("Producing StorageManager: db={} docker={} interval={}s workers={}",
                dbPath, dockerHost, checkIntervalSeconds, workerThreads);

        StorageManagerOptions options = StorageManagerOptions.builder()
                .checkInterval(Duration.ofSeconds(checkIntervalSeconds))
                .runTimeout(Duration.ofSeconds(runTimeoutSeconds))
                .workerThreads(workerThreads)
                .discoveryInterval(Duration.ofSeconds(discoveryIntervalSeconds))
                .labelPrefix(labelPrefix)
                .build();

        DockerEngineClient docker = DockerEngineClient.builder()
                .baseUrl(dockerHost)
                .timeout(Duration.ofSeconds(dockerTimeoutSeconds))
                .build();

        StorageManager manager = StorageManager.builder()
                .containerRuntime(docker)
                .registryFile(Path.of(dbPath))
                .options(options)
                .metricsService(metricsService())
                .build();
        manager.start();
        return manager;
    }

    public void closeStorageManager(@Disposes StorageManager manager) {
        log.info("Closing StorageManager");
        manager.close();
    }

    private MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Metrics enabled via Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }
}
