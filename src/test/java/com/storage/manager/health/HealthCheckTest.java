package com.storage.manager.health;

import com.storage.manager.algorithm.AlgorithmType;
import com.storage.manager.core.model.RegistrationDraft;
import com.storage.manager.metrics.NoOpMetricsService;
import com.storage.manager.registry.InMemoryRegistrationStore;
import com.storage.manager.registry.RegistryService;
import com.storage.manager.scheduler.CleanupRunner;
import com.storage.manager.scheduler.CleanupScheduler;
import com.storage.manager.scheduler.SchedulerConfig;
import com.storage.manager.testutil.FakeContainerRuntime;
import com.storage.manager.testutil.MutableClock;
import com.storage.manager.volume.VolumeResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private HealthCheck check(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }

        @Test
        @DisplayName("Should report UP with no checks registered")
        void emptyIsUp() {
            assertEquals(HealthStatus.Status.UP, new HealthCheckRegistry().checkAll().status());
        }

        @Test
        @DisplayName("Should answer 503 only when DOWN")
        void httpCodes() {
            assertEquals(200, HealthStatus.Status.UP.httpCode());
            assertEquals(200, HealthStatus.Status.DEGRADED.httpCode());
            assertEquals(503, HealthStatus.Status.DOWN.httpCode());
            assertTrue(HealthStatus.Status.DOWN.isWorseThan(HealthStatus.Status.DEGRADED));
            assertFalse(HealthStatus.Status.UP.isWorseThan(HealthStatus.Status.DEGRADED));
        }

        @Test
        @DisplayName("Should aggregate to the worst status")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.up()));
            registry.register(check("b", HealthStatus.degraded("slow")));
            assertEquals(HealthStatus.Status.DEGRADED, registry.checkAll().status());
            assertEquals("b: slow", registry.checkAll().message());

            registry.register(check("c", HealthStatus.down("gone")));
            HealthStatus all = registry.checkAll();
            assertEquals(HealthStatus.Status.DOWN, all.status());
            assertEquals(3, all.details().size());
        }

        @Test
        @DisplayName("Should treat a throwing check as DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("kaput");
                }
            });

            HealthStatus status = registry.checkAll();

            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertTrue(status.message().contains("kaput"));
        }
    }

    @Nested
    @DisplayName("ContainerRuntimeHealthCheck")
    class RuntimeTests {

        @Test
        @DisplayName("Should be DEGRADED, not DOWN, when the runtime is unreachable")
        void unreachableIsDegraded() {
            FakeContainerRuntime runtime = new FakeContainerRuntime();
            ContainerRuntimeHealthCheck check = new ContainerRuntimeHealthCheck(runtime);
            assertEquals(HealthStatus.Status.UP, check.check().status());

            runtime.setAvailable(false);
            HealthStatus status = check.check();

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals("fake", status.details().get("endpoint"));
        }
    }

    @Nested
    @DisplayName("SchedulerHealthCheck")
    class SchedulerTests {

        private final MutableClock clock = new MutableClock(Instant.parse("2026-07-01T00:00:00Z"));
        private RegistryService registry;
        private CleanupScheduler scheduler;
        private SchedulerHealthCheck check;

        @BeforeEach
        void setUp() {
            registry = new RegistryService(new InMemoryRegistrationStore(), AlgorithmType.catalog(clock), clock);
            SchedulerConfig config = new SchedulerConfig(Duration.ofHours(1), Duration.ofHours(1),
                    Duration.ofMinutes(10), 1, Duration.ofSeconds(1));
            CleanupRunner runner = new CleanupRunner(AlgorithmType.catalog(clock),
                    new VolumeResolver(new FakeContainerRuntime()));
            scheduler = new CleanupScheduler(registry, runner, config,
                    new NoOpMetricsService(), clock);
            check = new SchedulerHealthCheck(scheduler, registry, clock);
        }

        @AfterEach
        void tearDown() {
            scheduler.close();
        }

        @Test
        @DisplayName("Should be DOWN when the scheduler is not running")
        void notRunning() {
            HealthStatus status = check.check();

            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertEquals(false, status.details().get("schedulerRunning"));
        }

        @Test
        @DisplayName("Should degrade when no tick happened within two intervals plus the initial delay")
        void staleTick() {
            scheduler.start();
            assertEquals(HealthStatus.Status.UP, check.check().status());

            clock.advance(Duration.ofHours(3).plusSeconds(1));
            assertEquals(HealthStatus.Status.DEGRADED, check.check().status());

            scheduler.runOnce();
            assertEquals(HealthStatus.Status.UP, check.check().status());
        }

        @Test
        @DisplayName("Should list per-registration state and last result")
        @SuppressWarnings("unchecked")
        void registrationDetails() {
            registry.register(new RegistrationDraft("missing", "/", "max_size", Map.of("max_bytes", 10), null));
            scheduler.start();
            scheduler.runOnce();

            List<Map<String, Object>> registrations =
                    (List<Map<String, Object>>) check.check().details().get("registrations");

            assertEquals(1, registrations.size());
            Map<String, Object> entry = registrations.get(0);
            assertEquals("missing", entry.get("volumeName"));
            assertEquals("FAILED", entry.get("state"));
            assertEquals("failed", entry.get("lastStatus"));
            assertNotNull(entry.get("lastRunAt"));
        }
    }
}
