package com.storage.manager.registry;

import com.storage.manager.core.model.Registration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Non-durable store for tests and embedded use.
 */
public class InMemoryRegistrationStore implements RegistrationStore {

    private volatile List<Registration> registrations;
    private volatile int saveCount;

    public InMemoryRegistrationStore() {
        this(List.of());
    }

    public InMemoryRegistrationStore(Collection<Registration> initial) {
        this.registrations = List.copyOf(initial);
    }

    @Override
    public List<Registration> load() {
        return registrations;
    }

    @Override
    public synchronized void save(Collection<Registration> registrations) {
        this.registrations = List.copyOf(new ArrayList<>(registrations));
        saveCount++;
    }

    @Override
    public String describe() {
        return "memory";
    }

    /**
     * Number of completed saves.
     */
    public int saveCount() {
        return saveCount;
    }
}
