package com.storage.manager.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tracked (volume, path, algorithm, params) tuple with provenance and last-run state.
 * Instances are immutable; updates produce new instances.
 */
public record Registration(
        RegistrationKey key,
        String algorithm,
        Map<String, Object> params,
        String description,
        Provenance provenance,
        Instant createdAt,
        Instant updatedAt,
        Instant lastRunAt,
        CleanupResult lastResult
) {
    public Registration {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(algorithm, "algorithm is required");
        Objects.requireNonNull(provenance, "provenance is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(updatedAt, "updatedAt is required");
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
    }

    /**
     * Creates a fresh registration with no run history.
     */
    public static Registration create(RegistrationKey key, String algorithm, Map<String, Object> params,
                                      String description, Provenance provenance, Instant now) {
        return new Registration(key, algorithm, params, description, provenance, now, now, null, null);
    }

    /**
     * Applies a re-registration: definition and provenance come from {@code incoming},
     * creation time and run history are kept.
     */
    public Registration updatedFrom(Registration incoming, Instant now) {
        return new Registration(key, incoming.algorithm, incoming.params, incoming.description,
                incoming.provenance, createdAt, now, lastRunAt, lastResult);
    }

    public Registration withResult(CleanupResult result) {
        return new Registration(key, algorithm, params, description, provenance,
                createdAt, updatedAt, result.completedAt(), result);
    }

    public String volumeName() {
        return key.volumeName();
    }

    public String path() {
        return key.path();
    }

    public boolean hasResult() {
        return lastResult != null;
    }
}
