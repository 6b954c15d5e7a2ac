package com.storage.manager.algorithm;

/**
 * Lookup from algorithm identifier to implementation.
 */
@FunctionalInterface
public interface AlgorithmCatalog {

    /**
     * @throws com.storage.manager.core.exception.ValidationException for an unknown identifier
     */
    CleanupAlgorithm get(String algorithmId);
}
