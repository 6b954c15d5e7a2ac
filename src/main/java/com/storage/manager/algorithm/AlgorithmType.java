package com.storage.manager.algorithm;

import com.storage.manager.core.exception.ValidationException;

import java.time.Clock;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of built-in cleanup strategies. Adding a strategy means adding a
 * constant here; there is no runtime plugin loading.
 */
public enum AlgorithmType {
    MAX_SIZE(MaxSizeAlgorithm.ID, MaxSizeAlgorithm::new),
    REMOVE_BEFORE_DATE(RemoveBeforeDateAlgorithm.ID, RemoveBeforeDateAlgorithm::new),
    KEEP_N_LATEST(KeepNLatestAlgorithm.ID, KeepNLatestAlgorithm::new);

    private static final Map<String, AlgorithmType> BY_ID = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(AlgorithmType::id, Function.identity()));

    private final String id;
    private final Function<Clock, CleanupAlgorithm> factory;
    private final CleanupAlgorithm defaultInstance;

    AlgorithmType(String id, Function<Clock, CleanupAlgorithm> factory) {
        this.id = id;
        this.factory = factory;
        this.defaultInstance = factory.apply(Clock.systemUTC());
    }

    public String id() {
        return id;
    }

    /**
     * Shared instance using the system clock.
     */
    public CleanupAlgorithm algorithm() {
        return defaultInstance;
    }

    /**
     * New instance bound to the given clock.
     */
    public CleanupAlgorithm algorithm(Clock clock) {
        return factory.apply(clock);
    }

    /**
     * Looks up a strategy by identifier (case-insensitive).
     *
     * @throws ValidationException if the identifier is unknown
     */
    public static AlgorithmType fromId(String algorithmId) {
        if (algorithmId == null || algorithmId.isBlank()) {
            throw new ValidationException("algorithm is required");
        }
        AlgorithmType type = BY_ID.get(algorithmId.trim().toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new ValidationException("Unknown algorithm '" + algorithmId + "'. Allowed values: " +
                    BY_ID.keySet().stream().sorted().toList());
        }
        return type;
    }

    /**
     * Catalog over the built-in strategies, using the system clock.
     */
    public static AlgorithmCatalog catalog() {
        return id -> fromId(id).algorithm();
    }

    /**
     * Catalog over the built-in strategies, bound to the given clock.
     */
    public static AlgorithmCatalog catalog(Clock clock) {
        Map<AlgorithmType, CleanupAlgorithm> instances = Arrays.stream(values())
                .collect(Collectors.toUnmodifiableMap(Function.identity(), type -> type.algorithm(clock)));
        return id -> instances.get(fromId(id));
    }
}
