package com.storage.manager.api;

import com.storage.manager.scheduler.SchedulerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class StorageManagerOptionsTest {

    @Test
    @DisplayName("Should create default options")
    void testDefaultOptions() {
        StorageManagerOptions options = StorageManagerOptions.defaults();

        assertEquals(Duration.ofSeconds(300), options.getCheckInterval());
        assertEquals(Duration.ofSeconds(300), options.getDiscoveryInterval());
        assertEquals(Duration.ofSeconds(600), options.getRunTimeout());
        assertEquals(4, options.getWorkerThreads());
        assertTrue(options.isDiscoveryEnabled());
        assertEquals("storage-manager", options.getLabelPrefix());
    }

    @Test
    @DisplayName("Should carry scheduler settings into the scheduler config")
    void testSchedulerConfig() {
        StorageManagerOptions options = StorageManagerOptions.builder()
                .checkInterval(Duration.ofSeconds(30))
                .runTimeout(Duration.ofSeconds(90))
                .initialDelay(Duration.ZERO)
                .workerThreads(2)
                .build();

        SchedulerConfig config = options.schedulerConfig();

        assertEquals(Duration.ofSeconds(30), config.checkInterval());
        assertEquals(Duration.ofSeconds(90), config.runTimeout());
        assertEquals(Duration.ZERO, config.initialDelay());
        assertEquals(2, config.workerThreads());
    }

    @Test
    @DisplayName("Should reject invalid scheduler settings")
    void testInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> StorageManagerOptions.builder().workerThreads(0).build().schedulerConfig());
        assertThrows(IllegalArgumentException.class,
                () -> StorageManagerOptions.builder().checkInterval(Duration.ZERO).build().schedulerConfig());
    }
}
