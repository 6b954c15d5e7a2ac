package com.storage.manager.algorithm;

import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.ResolvedTarget;
import com.storage.manager.core.model.TargetStats;

import java.util.Map;

/**
 * Uniform contract of a cleanup strategy. Strategies operate purely on a resolved
 * target and their parameters; they know nothing about where a registration came from.
 */
public interface CleanupAlgorithm {

    /**
     * Stable identifier used in registrations and labels (e.g. {@code max_size}).
     */
    String id();

    /**
     * Validates raw parameters against this strategy's schema.
     *
     * @return canonical parameters with typed values and defaults applied
     * @throws com.storage.manager.core.exception.ValidationException if a parameter is
     *         unknown, missing, or out of range
     */
    Map<String, Object> validate(Map<String, ?> params);

    /**
     * Cheap pre-check: whether a run is warranted. Reads only the figures it needs from
     * {@code target} and never sorts.
     */
    boolean shouldClean(TargetStats target, Map<String, ?> params);

    /**
     * Performs the deletions. Individual failures are counted in the result, never thrown.
     */
    CleanupResult clean(ResolvedTarget target, Map<String, ?> params, FileDeleter deleter);
}
