package com.storage.manager.discovery;

import com.storage.manager.algorithm.AlgorithmType;
import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.core.model.Provenance;
import com.storage.manager.core.model.Registration;
import com.storage.manager.core.model.RegistrationDraft;
import com.storage.manager.core.model.RegistrationKey;
import com.storage.manager.metrics.MetricsService;
import com.storage.manager.registry.InMemoryRegistrationStore;
import com.storage.manager.registry.RegistryService;
import com.storage.manager.testutil.FakeContainerRuntime;
import com.storage.manager.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DiscoveryReconciler")
class DiscoveryReconcilerTest {

    private FakeContainerRuntime runtime;
    private RegistryService registry;
    @Mock
    private MetricsService metrics;
    private DiscoveryReconciler reconciler;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-04-01T00:00:00Z"));
        runtime = new FakeContainerRuntime();
        registry = new RegistryService(new InMemoryRegistrationStore(), AlgorithmType.catalog(clock), clock);
        reconciler = new DiscoveryReconciler(runtime, new LabelParser(AlgorithmType.catalog(clock)),
                registry, metrics, clock);
    }

    private static Map<String, String> labels(String volume, String path, long maxBytes) {
        return Map.of(
                "storage-manager.0.volume", volume,
                "storage-manager.0.path", path,
                "storage-manager.0.algorithm", "max_size",
                "storage-manager.0.max_bytes", Long.toString(maxBytes));
    }

    private long maxBytes(String volume, String path) {
        Registration registration = registry.get(RegistrationKey.of(volume, path)).orElseThrow();
        return ((Number) registration.params().get("max_bytes")).longValue();
    }

    @Nested
    @DisplayName("Applying labels")
    class Applying {

        @Test
        @DisplayName("creates label registrations and updates them when labels change")
        void createAndUpdate() {
            runtime.withContainer("app", labels("logs", "/", 100));

            SweepReport first = reconciler.sweep();
            assertEquals(1, first.containers());
            assertEquals(1, first.applied());
            assertEquals(Provenance.LABEL, registry.get(RegistrationKey.of("logs", "/")).orElseThrow().provenance());

            runtime.clearContainers();
            runtime.withContainer("app", labels("logs", "/", 200));
            reconciler.sweep();

            assertEquals(200, maxBytes("logs", "/"));
            assertNotNull(reconciler.lastReport());
        }

        @Test
        @DisplayName("a label draft colliding with an API registration is discarded")
        void apiRegistrationWins() {
            registry.register(new RegistrationDraft("logs", "/", "max_size", Map.of("max_bytes", 5), null));
            runtime.withContainer("app", labels("logs", "/", 100));

            SweepReport report = reconciler.sweep();

            assertEquals(0, report.applied());
            assertEquals(1, report.discarded());
            assertEquals(5, maxBytes("logs", "/"));
            assertEquals(Provenance.API, registry.get(RegistrationKey.of("logs", "/")).orElseThrow().provenance());
        }

        @Test
        @DisplayName("the same key declared by two containers is taken from the first by name")
        void crossContainerDuplicate() {
            runtime.withContainer("zeta", labels("logs", "/", 999));
            runtime.withContainer("alpha", labels("logs", "/", 111));

            SweepReport report = reconciler.sweep();

            assertEquals(1, report.applied());
            assertEquals(1, report.discarded());
            assertEquals(111, maxBytes("logs", "/"));
        }

        @Test
        @DisplayName("rejected groups are reported and do not block the valid ones")
        void rejections() {
            runtime.withContainer("app", Map.of(
                    "storage-manager.0.volume", "logs",
                    "storage-manager.0.path", "/",
                    "storage-manager.0.algorithm", "keep_n_latest",
                    "storage-manager.0.keep_count", "2",
                    "storage-manager.1.volume", "logs",
                    "storage-manager.1.algorithm", "max_size"));

            SweepReport report = reconciler.sweep();

            assertEquals(1, report.applied());
            assertEquals(1, report.rejected().size());
            assertEquals(1, report.rejected().get(0).index());
            verify(metrics).recordDiscovery("applied", 1);
            verify(metrics).recordDiscovery("rejected", 1);
        }
    }

    @Nested
    @DisplayName("Pruning")
    class Pruning {

        @Test
        @DisplayName("removes label registrations whose declaring container is gone")
        void pruneGone() {
            runtime.withContainer("app", labels("logs", "/", 100));
            reconciler.sweep();
            runtime.clearContainers();

            SweepReport report = reconciler.sweep();

            assertEquals(List.of(RegistrationKey.of("logs", "/")), report.pruned());
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("never removes API registrations")
        void apiUntouched() {
            registry.register(new RegistrationDraft("manual", "/", "max_size", Map.of("max_bytes", 5), null));

            SweepReport report = reconciler.sweep();

            assertTrue(report.pruned().isEmpty());
            assertTrue(registry.get(RegistrationKey.of("manual", "/")).isPresent());
        }

        @Test
        @DisplayName("an unreachable runtime aborts the sweep without pruning")
        void runtimeUnavailable() {
            runtime.withContainer("app", labels("logs", "/", 100));
            reconciler.sweep();
            runtime.setAvailable(false);

            assertThrows(TransientInfraException.class, () -> reconciler.sweep());

            assertEquals(1, registry.size());
            verify(metrics).recordDiscovery("failed", 1);
        }

        @Test
        @DisplayName("a group that turns invalid is pruned like a removed one")
        void invalidatedGroupPruned() {
            runtime.withContainer("app", labels("logs", "/", 100));
            reconciler.sweep();
            runtime.clearContainers();
            runtime.withContainer("app", labels("logs", "/", -1));

            SweepReport report = reconciler.sweep();

            assertEquals(1, report.rejected().size());
            assertEquals(List.of(RegistrationKey.of("logs", "/")), report.pruned());
        }
    }
}
