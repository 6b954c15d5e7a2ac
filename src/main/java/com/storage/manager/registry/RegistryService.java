package com.storage.manager.registry;

import com.storage.manager.algorithm.AlgorithmCatalog;
import com.storage.manager.algorithm.CleanupAlgorithm;
import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.Provenance;
import com.storage.manager.core.model.Registration;
import com.storage.manager.core.model.RegistrationDraft;
import com.storage.manager.core.model.RegistrationKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Single source of truth for registrations.
 *
 * <p>Writes are serialized by one lock and follow persist-then-publish: the new state is
 * saved to the {@link RegistrationStore} first and only then swapped in as the readable
 * snapshot. A failed save leaves both the store and the snapshot unchanged. Reads never
 * take the lock.</p>
 */
public class RegistryService {
    private static final Logger log = LoggerFactory.getLogger(RegistryService.class);

    private final RegistrationStore store;
    private final AlgorithmCatalog algorithms;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Map<RegistrationKey, Registration> current;

    /**
     * Loads the store eagerly.
     *
     * @throws com.storage.manager.core.exception.RegistryCorruptedException if the store is corrupt
     */
    public RegistryService(RegistrationStore store, AlgorithmCatalog algorithms, Clock clock) {
        this.store = store;
        this.algorithms = algorithms;
        this.clock = clock;
        Map<RegistrationKey, Registration> loaded = new TreeMap<>();
        for (Registration registration : store.load()) {
            loaded.put(registration.key(), registration);
        }
        this.current = Collections.unmodifiableMap(loaded);
        log.info("registry.loaded store={} count={}", store.describe(), loaded.size());
    }

    /**
     * Validates a draft and stores it with API provenance, replacing any registration
     * with the same key regardless of its provenance.
     *
     * @throws com.storage.manager.core.exception.ValidationException for a bad path,
     *         unknown algorithm or invalid parameters
     */
    public Registration register(RegistrationDraft draft) {
        return upsert(toRegistration(draft, Provenance.API));
    }

    /**
     * Validates a draft and stores it with LABEL provenance.
     *
     * @return false if an API registration already holds the key; the draft is then discarded
     */
    public boolean upsertDiscovered(RegistrationDraft draft) {
        Registration incoming = toRegistration(draft, Provenance.LABEL);
        writeLock.lock();
        try {
            Registration existing = current.get(incoming.key());
            if (existing != null && existing.provenance() == Provenance.API) {
                log.debug("registry.discovered.discarded key={} reason=api-registration", incoming.key());
                return false;
            }
            if (existing != null && sameDefinition(existing, incoming)) {
                return true;
            }
            applyLocked(incoming);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Inserts or replaces by key. Creation time and run history of an existing entry are kept.
     */
    public Registration upsert(Registration registration) {
        writeLock.lock();
        try {
            return applyLocked(registration);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return true if a registration was removed
     */
    public boolean remove(RegistrationKey key) {
        writeLock.lock();
        try {
            if (!current.containsKey(key)) {
                return false;
            }
            publish(map -> {
                map.remove(key);
                return map;
            });
            log.info("registry.removed key={}", key);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Stores the result of a run. A key removed while the run was in flight is ignored.
     */
    public void recordResult(RegistrationKey key, CleanupResult result) {
        writeLock.lock();
        try {
            Registration existing = current.get(key);
            if (existing == null) {
                log.debug("registry.result.ignored key={} reason=removed", key);
                return;
            }
            Registration updated = existing.withResult(result);
            publish(map -> {
                map.put(key, updated);
                return map;
            });
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes every LABEL registration whose key is not in {@code observed}.
     *
     * @return the removed registrations
     */
    public List<Registration> removeStaleDiscovered(Set<RegistrationKey> observed) {
        writeLock.lock();
        try {
            List<Registration> stale = new ArrayList<>();
            for (Registration registration : current.values()) {
                if (registration.provenance() == Provenance.LABEL && !observed.contains(registration.key())) {
                    stale.add(registration);
                }
            }
            if (stale.isEmpty()) {
                return List.of();
            }
            publish(map -> {
                stale.forEach(r -> map.remove(r.key()));
                return map;
            });
            stale.forEach(r -> log.info("registry.pruned key={} provenance=label", r.key()));
            return List.copyOf(stale);
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<Registration> get(RegistrationKey key) {
        return Optional.ofNullable(current.get(key));
    }

    /**
     * Lists matching registrations ordered by volume name, then path.
     */
    public List<Registration> list(RegistrationFilter filter) {
        return current.values().stream().filter(filter).toList();
    }

    /**
     * Immutable point-in-time view of every registration, ordered by key.
     */
    public List<Registration> snapshot() {
        return List.copyOf(current.values());
    }

    public int size() {
        return current.size();
    }

    private Registration toRegistration(RegistrationDraft draft, Provenance provenance) {
        RegistrationKey key = RegistrationKey.of(draft.volumeName(), draft.path());
        CleanupAlgorithm algorithm = algorithms.get(draft.algorithm());
        Map<String, Object> params = algorithm.validate(draft.params());
        return Registration.create(key, algorithm.id(), params, draft.description(), provenance, clock.instant());
    }

    private Registration applyLocked(Registration incoming) {
        Registration existing = current.get(incoming.key());
        Registration stored = existing != null ? existing.updatedFrom(incoming, clock.instant()) : incoming;
        publish(map -> {
            map.put(stored.key(), stored);
            return map;
        });
        log.info("registry.upserted key={} algorithm={} provenance={} created={}",
                stored.key(), stored.algorithm(), stored.provenance().wireName(), existing == null);
        return stored;
    }

    private void publish(UnaryOperator<Map<RegistrationKey, Registration>> change) {
        Map<RegistrationKey, Registration> next = change.apply(new TreeMap<>(current));
        store.save(next.values());
        current = Collections.unmodifiableMap(next);
    }

    private boolean sameDefinition(Registration existing, Registration incoming) {
        return existing.provenance() == incoming.provenance()
                && existing.algorithm().equals(incoming.algorithm())
                && Objects.equals(existing.description(), incoming.description())
                && canonicalParams(existing).equals(incoming.params());
    }

    /**
     * Params as {@link CleanupAlgorithm#validate} would produce them. Reloaded entries carry
     * whatever numeric types the store decoded; params that no longer validate are returned as is.
     */
    private Map<String, Object> canonicalParams(Registration registration) {
        try {
            return algorithms.get(registration.algorithm()).validate(registration.params());
        } catch (ValidationException e) {
            log.debug("registry.params.notCanonical key={} error={}", registration.key(), e.getMessage());
            return registration.params();
        }
    }
}
