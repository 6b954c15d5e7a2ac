package com.storage.manager.metrics;

import com.storage.manager.core.model.CleanupResult;

/**
 * Interface for recording storage manager metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a meter registry.
 */
public interface MetricsService {

    /**
     * Records a finished run: its duration by status plus files removed, bytes freed and failures.
     */
    void recordCleanup(CleanupResult result);

    /**
     * A tick skipped a registration because its previous run still holds the key.
     */
    void incrementDispatchSkipped();

    /**
     * Records discovery outcomes ({@code applied}, {@code discarded}, {@code rejected},
     * {@code pruned}, {@code failed}).
     */
    void recordDiscovery(String outcome, int count);
}
