package com.storage.manager.api;

import com.storage.manager.discovery.LabelParser;
import com.storage.manager.scheduler.SchedulerConfig;

import java.time.Duration;

/**
 * Tuning options for a {@link StorageManager}: scheduling, discovery and usage caching.
 */
public class StorageManagerOptions {

    private static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(300);
    private static final Duration DEFAULT_DISCOVERY_INTERVAL = Duration.ofSeconds(300);
    private static final Duration DEFAULT_RUN_TIMEOUT = Duration.ofSeconds(600);
    private static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(10);
    private static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);
    private static final Duration DEFAULT_USAGE_CACHE_TTL = Duration.ofSeconds(60);
    private static final int DEFAULT_WORKER_THREADS = 4;
    private static final long DEFAULT_USAGE_CACHE_MAX_SIZE = 1_000;

    private final Duration checkInterval;
    private final Duration discoveryInterval;
    private final Duration runTimeout;
    private final Duration initialDelay;
    private final Duration shutdownGrace;
    private final int workerThreads;
    private final boolean discoveryEnabled;
    private final String labelPrefix;
    private final Duration usageCacheTtl;
    private final long usageCacheMaxSize;

    private StorageManagerOptions(Builder builder) {
        this.checkInterval = builder.checkInterval;
        this.discoveryInterval = builder.discoveryInterval;
        this.runTimeout = builder.runTimeout;
        this.initialDelay = builder.initialDelay;
        this.shutdownGrace = builder.shutdownGrace;
        this.workerThreads = builder.workerThreads;
        this.discoveryEnabled = builder.discoveryEnabled;
        this.labelPrefix = builder.labelPrefix;
        this.usageCacheTtl = builder.usageCacheTtl;
        this.usageCacheMaxSize = builder.usageCacheMaxSize;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public Duration getDiscoveryInterval() {
        return discoveryInterval;
    }

    public Duration getRunTimeout() {
        return runTimeout;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public boolean isDiscoveryEnabled() {
        return discoveryEnabled;
    }

    public String getLabelPrefix() {
        return labelPrefix;
    }

    public Duration getUsageCacheTtl() {
        return usageCacheTtl;
    }

    public long getUsageCacheMaxSize() {
        return usageCacheMaxSize;
    }

    public SchedulerConfig schedulerConfig() {
        return new SchedulerConfig(checkInterval, initialDelay, runTimeout, workerThreads, shutdownGrace);
    }

    public static StorageManagerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
        private Duration discoveryInterval = DEFAULT_DISCOVERY_INTERVAL;
        private Duration runTimeout = DEFAULT_RUN_TIMEOUT;
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private Duration shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private boolean discoveryEnabled = true;
        private String labelPrefix = LabelParser.DEFAULT_PREFIX;
        private Duration usageCacheTtl = DEFAULT_USAGE_CACHE_TTL;
        private long usageCacheMaxSize = DEFAULT_USAGE_CACHE_MAX_SIZE;

        public Builder checkInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
            return this;
        }

        public Builder discoveryInterval(Duration discoveryInterval) {
            this.discoveryInterval = discoveryInterval;
            return this;
        }

        public Builder runTimeout(Duration runTimeout) {
            this.runTimeout = runTimeout;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        /**
         * Disables periodic label discovery; {@link StorageManager#sweep()} still works.
         */
        public Builder discoveryEnabled(boolean discoveryEnabled) {
            this.discoveryEnabled = discoveryEnabled;
            return this;
        }

        public Builder labelPrefix(String labelPrefix) {
            this.labelPrefix = labelPrefix;
            return this;
        }

        public Builder usageCacheTtl(Duration usageCacheTtl) {
            this.usageCacheTtl = usageCacheTtl;
            return this;
        }

        public Builder usageCacheMaxSize(long usageCacheMaxSize) {
            this.usageCacheMaxSize = usageCacheMaxSize;
            return this;
        }

        public StorageManagerOptions build() {
            if (discoveryInterval == null || discoveryInterval.isZero() || discoveryInterval.isNegative()) {
                throw new IllegalArgumentException("discoveryInterval must be > 0");
            }
            if (labelPrefix == null || labelPrefix.isBlank()) {
                throw new IllegalArgumentException("labelPrefix must not be blank");
            }
            StorageManagerOptions options = new StorageManagerOptions(this);
            // rejects invalid scheduler settings
            options.schedulerConfig();
            return options;
        }
    }
}
