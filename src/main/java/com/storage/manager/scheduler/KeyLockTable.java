package com.storage.manager.scheduler;

import com.storage.manager.core.model.RegistrationKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-blocking per-key locks. A lock may be released by a thread other than the one
 * that acquired it, since the dispatcher acquires and the worker releases.
 */
public class KeyLockTable {
    private static final Logger log = LoggerFactory.getLogger(KeyLockTable.class);

    private final Set<RegistrationKey> held = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the lock was free and is now held by the caller
     */
    public boolean tryAcquire(RegistrationKey key) {
        boolean acquired = held.add(key);
        if (acquired) {
            log.debug("Lock acquired: {}", key);
        }
        return acquired;
    }

    public void release(RegistrationKey key) {
        if (held.remove(key)) {
            log.debug("Lock released: {}", key);
        }
    }

    public boolean isLocked(RegistrationKey key) {
        return held.contains(key);
    }

    public int size() {
        return held.size();
    }
}
