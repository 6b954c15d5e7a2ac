package com.storage.manager.metrics;

import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.CleanupStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-01T00:00:00Z");

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordCleanup(CleanupResult.compliant(Duration.ZERO, NOW));
                noOp.incrementDispatchSkipped();
                noOp.recordDiscovery("applied", 3);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record cleanup duration by status and accumulate counters")
        void recordCleanup() {
            metrics.recordCleanup(new CleanupResult(3, 3000, 1, List.of("permission denied: /x"),
                    Duration.ofMillis(150), CleanupStatus.COMPLETED, NOW));
            metrics.recordCleanup(new CleanupResult(2, 500, 0, List.of(),
                    Duration.ofMillis(250), CleanupStatus.COMPLETED, NOW));
            metrics.recordCleanup(CleanupResult.failed("boom", Duration.ofMillis(5), NOW));

            Timer completed = registry.find("storage.cleanup.duration").tag("status", "completed").timer();
            assertNotNull(completed);
            assertEquals(2, completed.count());
            Timer failed = registry.find("storage.cleanup.duration").tag("status", "failed").timer();
            assertNotNull(failed);
            assertEquals(1, failed.count());

            assertEquals(5.0, registry.find("storage.cleanup.files.removed").counter().count());
            assertEquals(3500.0, registry.find("storage.cleanup.bytes.freed").counter().count());
            assertEquals(1.0, registry.find("storage.cleanup.files.failed").counter().count());
        }

        @Test
        @DisplayName("Should count skipped dispatches")
        void dispatchSkipped() {
            metrics.incrementDispatchSkipped();
            metrics.incrementDispatchSkipped();

            assertEquals(2.0, registry.find("storage.scheduler.dispatch.skipped").counter().count());
        }

        @Test
        @DisplayName("Should count discovery outcomes by tag and ignore empty counts")
        void discovery() {
            metrics.recordDiscovery("applied", 2);
            metrics.recordDiscovery("applied", 1);
            metrics.recordDiscovery("pruned", 0);

            Counter applied = registry.find("storage.discovery.registrations").tag("outcome", "applied").counter();
            assertNotNull(applied);
            assertEquals(3.0, applied.count());
            assertNull(registry.find("storage.discovery.registrations").tag("outcome", "pruned").counter());
        }
    }
}
