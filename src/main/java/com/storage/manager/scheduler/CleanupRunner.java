package com.storage.manager.scheduler;

import com.storage.manager.algorithm.AlgorithmCatalog;
import com.storage.manager.algorithm.CleanupAlgorithm;
import com.storage.manager.algorithm.FileDeleter;
import com.storage.manager.core.exception.StorageManagerException;
import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.Registration;
import com.storage.manager.core.model.ResolvedTarget;
import com.storage.manager.core.model.TargetStats;
import com.storage.manager.volume.VolumeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Executes one cleanup run for a registration: algorithm lookup, target resolution,
 * the cheap pre-check and, only when it asks for a run, enumeration and deletions.
 * Never throws; every failure becomes a FAILED result so the next tick can retry.
 */
public class CleanupRunner {
    private static final Logger log = LoggerFactory.getLogger(CleanupRunner.class);

    private final AlgorithmCatalog algorithms;
    private final VolumeResolver resolver;
    private final FileDeleter deleter;
    private final Clock clock;

    public CleanupRunner(AlgorithmCatalog algorithms, VolumeResolver resolver) {
        this(algorithms, resolver, FileDeleter.defaultDeleter(), Clock.systemUTC());
    }

    public CleanupRunner(AlgorithmCatalog algorithms, VolumeResolver resolver, FileDeleter deleter, Clock clock) {
        this.algorithms = algorithms;
        this.resolver = resolver;
        this.deleter = deleter;
        this.clock = clock;
    }

    public CleanupResult run(Registration registration) {
        Instant start = clock.instant();
        try {
            CleanupAlgorithm algorithm = algorithms.get(registration.algorithm());
            TargetStats stats = resolver.inspectTarget(registration.key());
            if (!algorithm.shouldClean(stats, registration.params())) {
                log.debug("cleanup.compliant root={}", stats.root());
                return CleanupResult.compliant(Duration.between(start, clock.instant()), clock.instant());
            }
            ResolvedTarget target = resolver.enumerate(stats);
            CleanupResult result = algorithm.clean(target, registration.params(), deleter);
            if (result.hasPartialFailures()) {
                log.warn("cleanup.partial removed={} failed={} errors={}",
                        result.filesRemoved(), result.filesFailed(), result.errors());
            }
            return result;
        } catch (StorageManagerException e) {
            log.warn("cleanup.failed type={} error={}", e.getClass().getSimpleName(), e.getMessage());
            return CleanupResult.failed(e.getMessage(), Duration.between(start, clock.instant()), clock.instant());
        } catch (RuntimeException e) {
            log.error("cleanup.failed type={} error={}", e.getClass().getSimpleName(), e.getMessage(), e);
            return CleanupResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage(),
                    Duration.between(start, clock.instant()), clock.instant());
        }
    }
}
