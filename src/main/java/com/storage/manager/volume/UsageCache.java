package com.storage.manager.volume;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.function.ToLongFunction;

/**
 * Caffeine-backed cache of byte-usage figures, so listing and health endpoints do not
 * walk whole volumes on every request. Failed computations are not cached.
 */
public class UsageCache {
    private static final Logger log = LoggerFactory.getLogger(UsageCache.class);

    private final Cache<String, Long> cache;

    public UsageCache(Duration ttl, long maxSize) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        log.info("UsageCache initialized: maxSize={}, ttl={}s", maxSize, ttl.toSeconds());
    }

    /**
     * Returns the cached figure for {@code key}, computing it on a miss.
     * A negative computed value means "unknown" and is reported as empty.
     */
    public <K> OptionalLong get(String cacheKey, K key, ToLongFunction<K> compute) {
        Long value = cache.get(cacheKey, k -> compute.applyAsLong(key));
        return value != null && value >= 0 ? OptionalLong.of(value) : OptionalLong.empty();
    }

    public void invalidate(String cacheKey) {
        cache.invalidate(cacheKey);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
