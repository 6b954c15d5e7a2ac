package com.storage.manager.scheduler;

import com.storage.manager.core.model.RegistrationKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyLockTable")
class KeyLockTableTest {

    private final KeyLockTable locks = new KeyLockTable();
    private final RegistrationKey key = RegistrationKey.of("logs", "/");

    @Test
    @DisplayName("a held key cannot be acquired again until released")
    void exclusive() {
        assertTrue(locks.tryAcquire(key));
        assertFalse(locks.tryAcquire(key));
        assertTrue(locks.tryAcquire(RegistrationKey.of("logs", "/other")));
        assertEquals(2, locks.size());

        locks.release(key);
        assertFalse(locks.isLocked(key));
        assertTrue(locks.tryAcquire(key));
    }

    @Test
    @DisplayName("another thread may release the lock")
    void crossThreadRelease() {
        assertTrue(locks.tryAcquire(key));

        CompletableFuture.runAsync(() -> locks.release(key)).join();

        assertFalse(locks.isLocked(key));
    }

    @Test
    @DisplayName("releasing a free key is a no-op")
    void releaseFree() {
        locks.release(key);
        assertEquals(0, locks.size());
    }
}
