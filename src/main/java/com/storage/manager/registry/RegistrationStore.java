package com.storage.manager.registry;

import com.storage.manager.core.model.Registration;

import java.util.Collection;
import java.util.List;

/**
 * Durable backing store for the registry.
 * Implementations provide different storage backends (in-memory, JSON file).
 */
public interface RegistrationStore {

    /**
     * Loads every persisted registration.
     *
     * @throws com.storage.manager.core.exception.RegistryCorruptedException if the store
     *         exists but cannot be read or parsed
     */
    List<Registration> load();

    /**
     * Replaces the persisted content with the given registrations.
     *
     * @throws com.storage.manager.core.exception.TransientInfraException if the write fails;
     *         the previous content must then still be intact
     */
    void save(Collection<Registration> registrations);

    /**
     * Human-readable location for logs.
     */
    String describe();
}
