package com.storage.manager.metrics;

import com.storage.manager.core.model.CleanupResult;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCleanup(CleanupResult result) {
    }

    @Override
    public void incrementDispatchSkipped() {
    }

    @Override
    public void recordDiscovery(String outcome, int count) {
    }
}
